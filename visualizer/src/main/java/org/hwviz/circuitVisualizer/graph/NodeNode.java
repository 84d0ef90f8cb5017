package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

/** A wire or a named intermediate value. */
public final class NodeNode extends GraphNode {
    public NodeNode(String name, ModuleNode parent) {
        super(name, parent);
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append(this.dotId())
                .append(" [ shape=ellipse label=")
                .appendQuoted(this.name)
                .append(" ]")
                .newline();
    }
}
