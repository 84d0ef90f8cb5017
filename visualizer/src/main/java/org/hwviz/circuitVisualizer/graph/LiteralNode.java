package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

import java.math.BigInteger;

/** A constant.  Every occurrence of a constant gets its own node. */
public final class LiteralNode extends GraphNode {
    public final BigInteger value;

    public LiteralNode(String name, BigInteger value, ModuleNode parent) {
        super(name, parent);
        this.value = value;
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append(this.dotId())
                .append(" [ shape=circle label=")
                .appendQuoted(this.value.toString())
                .append(" ]")
                .newline();
    }
}
