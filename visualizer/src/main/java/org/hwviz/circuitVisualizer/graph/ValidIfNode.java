package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.Linq;

import java.util.List;

public final class ValidIfNode extends RecordNode {
    public ValidIfNode(String name, ModuleNode parent) {
        super(name, parent);
    }

    public String select() {
        return this.terminal(MuxNode.SELECT);
    }

    public String in1() {
        return this.terminal(OperatorNode.IN1);
    }

    @Override
    protected List<String> inputs() {
        return Linq.list(MuxNode.SELECT, OperatorNode.IN1);
    }

    @Override
    protected String label() {
        return "validif";
    }
}
