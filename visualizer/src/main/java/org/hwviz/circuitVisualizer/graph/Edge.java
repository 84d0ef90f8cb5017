package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

/** A directed dataflow edge between two node references.
 * References are plain strings, so an edge may point to an endpoint
 * that no node declares. */
public final class Edge {
    public final String source;
    public final String sink;

    public Edge(String source, String sink) {
        this.source = source;
        this.sink = sink;
    }

    static String endpoint(String reference) {
        return reference.isEmpty() ? "\"\"" : reference;
    }

    public void render(IIndentStream stream) {
        stream.append(endpoint(this.source))
                .append(" -> ")
                .append(endpoint(this.sink))
                .append(";")
                .newline();
    }

    @Override
    public String toString() {
        return this.source + " -> " + this.sink;
    }
}
