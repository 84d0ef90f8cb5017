package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

/** Access to a vector element with a constant index, e.g., {@code v[3]}. */
public final class SubIndex extends Expression {
    public final Expression expr;
    public final int value;

    public SubIndex(Expression expr, int value) {
        this.expr = expr;
        this.value = value;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expr.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expr)
                .append("[")
                .append(this.value)
                .append("]");
    }

    @SuppressWarnings("unused")
    public static SubIndex fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression expr = fromJsonNode(node, "expr", reader, Expression.class);
        int value = Utilities.getIntProperty(node, "value");
        return new SubIndex(expr, value);
    }
}
