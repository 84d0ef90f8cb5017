package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

import java.util.List;

/** A node drawn as a Graphviz record, with one field per input
 * terminal and a single output terminal. */
public abstract class RecordNode extends GraphNode {
    static final String OUT = "out";

    protected RecordNode(String name, ModuleNode parent) {
        super(name, parent);
    }

    /** Names of the input fields, in the order they are drawn. */
    protected abstract List<String> inputs();

    /** Text displayed in the middle of the record. */
    protected abstract String label();

    /** Reference to one field of this record. */
    public String terminal(String field) {
        return this.dotId() + ":" + field;
    }

    public String out() {
        return this.terminal(OUT);
    }

    @Override
    public String asRhs() {
        return this.out();
    }

    /** Escape the characters that structure a record label. */
    static String escapeRecord(String text) {
        StringBuilder builder = new StringBuilder();
        for (char c: text.toCharArray()) {
            switch (c) {
                case '{', '}', '|', '<', '>', '"', '\\', ' ' -> builder.append('\\');
                default -> {}
            }
            builder.append(c);
        }
        return builder.toString();
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append(this.dotId())
                .append(" [ shape=record label=\"{{");
        boolean first = true;
        for (String input: this.inputs()) {
            if (!first)
                stream.append("|");
            first = false;
            stream.append("<").append(input).append("> ").append(input);
        }
        stream.append("}|")
                .append(escapeRecord(this.label()))
                .append("|<")
                .append(OUT)
                .append("> ")
                .append(OUT)
                .append("}\" ]")
                .newline();
    }
}
