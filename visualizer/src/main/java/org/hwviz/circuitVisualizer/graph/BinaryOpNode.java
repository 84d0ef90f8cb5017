package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.Linq;

import java.util.List;

public final class BinaryOpNode extends OperatorNode {
    public BinaryOpNode(String name, String symbol, ModuleNode parent) {
        super(name, symbol, parent);
    }

    public String in2() {
        return this.terminal(IN2);
    }

    @Override
    protected List<String> inputs() {
        return Linq.list(IN1, IN2);
    }
}
