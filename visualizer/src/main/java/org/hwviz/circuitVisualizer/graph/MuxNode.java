package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.Linq;

import java.util.List;

/** Multiplexer: {@code in1} is selected when {@code select} is true, {@code in2} otherwise. */
public final class MuxNode extends RecordNode {
    static final String SELECT = "select";

    public MuxNode(String name, ModuleNode parent) {
        super(name, parent);
    }

    public String select() {
        return this.terminal(SELECT);
    }

    public String in1() {
        return this.terminal(OperatorNode.IN1);
    }

    public String in2() {
        return this.terminal(OperatorNode.IN2);
    }

    @Override
    protected List<String> inputs() {
        return Linq.list(SELECT, OperatorNode.IN1, OperatorNode.IN2);
    }

    @Override
    protected String label() {
        return "mux";
    }
}
