package org.hwviz.circuitVisualizer.graph;

/** A node for a primitive operation; the node name is derived from
 * the operation symbol, and the symbol is displayed in the record. */
public abstract class OperatorNode extends RecordNode {
    static final String IN1 = "in1";
    static final String IN2 = "in2";

    public final String symbol;

    protected OperatorNode(String name, String symbol, ModuleNode parent) {
        super(name, parent);
        this.symbol = symbol;
    }

    public String in1() {
        return this.terminal(IN1);
    }

    @Override
    protected String label() {
        return this.symbol;
    }
}
