package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A module instance: a container of graph nodes and of the edges between them.
 * Nested module instances are drawn as nested Graphviz clusters. */
public final class ModuleNode extends GraphNode {
    final List<GraphNode> children;
    final List<Edge> edges;
    int sequence;

    public ModuleNode(String name, @Nullable ModuleNode parent) {
        super(name, parent);
        this.children = new ArrayList<>();
        this.edges = new ArrayList<>();
        this.sequence = 0;
    }

    /** Append a child.  Children with the same name are all kept. */
    public void addChild(GraphNode node) {
        Utilities.enforce(node.parent == this, "Adding " + node + " to wrong parent " + this);
        this.children.add(node);
    }

    /** Append an edge from {@code source} to {@code sink}. */
    public void connect(String sink, String source) {
        this.edges.add(new Edge(source, sink));
    }

    /** A number that is different each time it is called on the same container;
     * used to give unique names to synthesized nodes. */
    public int nextSequence() {
        return this.sequence++;
    }

    public List<GraphNode> getChildren() {
        return Collections.unmodifiableList(this.children);
    }

    public List<Edge> getEdges() {
        return Collections.unmodifiableList(this.edges);
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append("subgraph ")
                .append(quoteId("cluster_" + this.absoluteName()))
                .append(" {")
                .increase()
                .append("label=")
                .appendQuoted(this.name)
                .newline();
        for (GraphNode child: this.children)
            child.render(stream);
        for (Edge edge: this.edges)
            edge.render(stream);
        stream.decrease()
                .append("}")
                .newline();
    }
}
