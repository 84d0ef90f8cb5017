package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** Marks a sink as having no defined value. */
public final class IsInvalid extends Statement {
    public final Expression expr;

    public IsInvalid(Expression expr) {
        this.expr = expr;
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
                .append(" is invalid");
    }

    @SuppressWarnings("unused")
    public static IsInvalid fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression expr = fromJsonNode(node, "expr", reader, Expression.class);
        return new IsInvalid(expr);
    }
}
