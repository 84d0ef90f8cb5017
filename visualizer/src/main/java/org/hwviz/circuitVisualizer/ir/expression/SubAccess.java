package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** Access to a vector element with a dynamic index, e.g., {@code v[i]}. */
public final class SubAccess extends Expression {
    public final Expression expr;
    public final Expression index;

    public SubAccess(Expression expr, Expression index) {
        this.expr = expr;
        this.index = index;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expr.accept(visitor);
        this.index.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expr)
                .append("[")
                .append(this.index)
                .append("]");
    }

    @SuppressWarnings("unused")
    public static SubAccess fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression expr = fromJsonNode(node, "expr", reader, Expression.class);
        Expression index = fromJsonNode(node, "index", reader, Expression.class);
        return new SubAccess(expr, index);
    }
}
