package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

/** Access to a named field of a bundle, e.g., {@code inst.port}. */
public final class SubField extends Expression {
    public final Expression expr;
    public final String name;

    public SubField(Expression expr, String name) {
        this.expr = expr;
        this.name = name;
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
                .append(".")
                .append(this.name);
    }

    @SuppressWarnings("unused")
    public static SubField fromJson(JsonNode node, CircuitJsonReader reader) {
        Expression expr = fromJsonNode(node, "expr", reader, Expression.class);
        String name = Utilities.getStringProperty(node, "name");
        return new SubField(expr, name);
    }
}
