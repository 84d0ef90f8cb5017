package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.Linq;

import java.util.List;

/** An operation with one data input and one constant parameter, e.g., {@code shl(3)}. */
public final class OneArgOneParamOpNode extends OperatorNode {
    public final long param;

    public OneArgOneParamOpNode(String name, String symbol, long param, ModuleNode parent) {
        super(name, symbol, parent);
        this.param = param;
    }

    @Override
    protected List<String> inputs() {
        return Linq.list(IN1);
    }

    @Override
    protected String label() {
        return this.symbol + "(" + this.param + ")";
    }
}
