package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** {@code cond ? tval : fval} */
public final class Mux extends Expression {
    public final Expression cond;
    public final Expression tval;
    public final Expression fval;

    public Mux(Expression cond, Expression tval, Expression fval) {
        this.cond = cond;
        this.tval = tval;
        this.fval = fval;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.cond.accept(visitor);
        this.tval.accept(visitor);
        this.fval.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("mux(")
                .append(this.cond)
                .append(", ")
                .append(this.tval)
                .append(", ")
                .append(this.fval)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static Mux fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression cond = fromJsonNode(node, "cond", reader, Expression.class);
        Expression tval = fromJsonNode(node, "tval", reader, Expression.class);
        Expression fval = fromJsonNode(node, "fval", reader, Expression.class);
        return new Mux(cond, tval, fval);
    }
}
