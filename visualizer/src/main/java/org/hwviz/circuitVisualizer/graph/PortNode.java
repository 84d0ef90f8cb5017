package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

/** A module port; it can be both the source and the sink of edges. */
public final class PortNode extends GraphNode {
    public PortNode(String name, ModuleNode parent) {
        super(name, parent);
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append(this.dotId())
                .append(" [ shape=box label=")
                .appendQuoted(this.name)
                .append(" ]")
                .newline();
    }
}
