package org.hwviz.circuitVisualizer.visitors;

import org.hwviz.circuitVisualizer.errors.IErrorReporter;
import org.hwviz.circuitVisualizer.ir.IRNode;
import org.hwviz.util.Utilities;

import java.util.HashMap;
import java.util.Map;

/** A Visitor which computes a translation for each node it visits.
 * @param <T> The type of objects produced by the translation. */
public abstract class TranslateVisitor<T> extends IRVisitor {
    /** Indexed by node id.  A node visited again gets a fresh translation. */
    final Map<Long, T> translation;

    protected TranslateVisitor(IErrorReporter reporter) {
        super(reporter);
        this.translation = new HashMap<>();
    }

    protected void set(IRNode node, T value) {
        this.translation.put(node.getId(), value);
    }

    public T get(IRNode node) {
        return Utilities.getExists(this.translation, node.getId());
    }

    /** Visit a node and return its translation. */
    protected T analyze(IRNode node) {
        node.accept(this);
        return this.get(node);
    }
}
