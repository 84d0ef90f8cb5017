package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** The value is only defined when {@code cond} is true. */
public final class ValidIf extends Expression {
    public final Expression cond;
    public final Expression value;

    public ValidIf(Expression cond, Expression value) {
        this.cond = cond;
        this.value = value;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.cond.accept(visitor);
        this.value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("validif(")
                .append(this.cond)
                .append(", ")
                .append(this.value)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static ValidIf fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression cond = fromJsonNode(node, "cond", reader, Expression.class);
        Expression value = fromJsonNode(node, "value", reader, Expression.class);
        return new ValidIf(cond, value);
    }
}
