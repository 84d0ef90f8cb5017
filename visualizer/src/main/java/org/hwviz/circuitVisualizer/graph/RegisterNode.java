package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

/** A register.  Writes go to the {@code in} terminal, while reads use
 * the node itself, so the next value and the current value stay distinct. */
public final class RegisterNode extends GraphNode {
    static final String IN = "in";

    public RegisterNode(String name, ModuleNode parent) {
        super(name, parent);
    }

    /** Terminal written by connections whose sink is this register. */
    public String in() {
        return this.dotId() + ":" + IN;
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append(this.dotId())
                .append(" [ shape=record label=\"{<")
                .append(IN)
                .append("> next|")
                .append(RecordNode.escapeRecord(this.name))
                .append("}\" ]")
                .newline();
    }
}
