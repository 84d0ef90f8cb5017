package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** Connect the value of {@code expr} to the sink {@code loc}. */
public final class Connect extends Statement {
    public final Expression loc;
    public final Expression expr;

    public Connect(Expression loc, Expression expr) {
        this.loc = loc;
        this.expr = expr;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.loc.accept(visitor);
        this.expr.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.loc)
                .append(" <= ")
                .append(this.expr);
    }

    @SuppressWarnings("unused")
    public static Connect fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression loc = fromJsonNode(node, "loc", reader, Expression.class);
        Expression expr = fromJsonNode(node, "expr", reader, Expression.class);
        return new Connect(loc, expr);
    }
}
