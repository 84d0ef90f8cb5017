package org.hwviz.circuitVisualizer.ir.expression;

import org.hwviz.circuitVisualizer.ir.IRNode;

/** Base class for expressions. */
public abstract class Expression extends IRNode {
    protected Expression() {}
}
