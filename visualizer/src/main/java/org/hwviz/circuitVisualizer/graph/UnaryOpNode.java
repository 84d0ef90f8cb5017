package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.Linq;

import java.util.List;

public final class UnaryOpNode extends OperatorNode {
    public UnaryOpNode(String name, String symbol, ModuleNode parent) {
        super(name, symbol, parent);
    }

    @Override
    protected List<String> inputs() {
        return Linq.list(IN1);
    }
}
