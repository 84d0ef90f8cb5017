package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.Linq;

import java.util.List;

/** An operation with one data input and two constant parameters, e.g., {@code bits(7, 4)}. */
public final class OneArgTwoParamOpNode extends OperatorNode {
    public final long param1;
    public final long param2;

    public OneArgTwoParamOpNode(String name, String symbol, long param1, long param2, ModuleNode parent) {
        super(name, symbol, parent);
        this.param1 = param1;
        this.param2 = param2;
    }

    @Override
    protected List<String> inputs() {
        return Linq.list(IN1);
    }

    @Override
    protected String label() {
        return this.symbol + "(" + this.param1 + ", " + this.param2 + ")";
    }
}
