package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

/** A named intermediate value. */
public final class DefNode extends Statement {
    public final String name;
    public final Expression value;

    public DefNode(String name, Expression value) {
        this.name = name;
        this.value = value;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.value.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("node ")
                .append(this.name)
                .append(" = ")
                .append(this.value);
    }

    @SuppressWarnings("unused")
    public static DefNode fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        Expression value = fromJsonNode(node, "value", reader, Expression.class);
        return new DefNode(name, value);
    }
}
