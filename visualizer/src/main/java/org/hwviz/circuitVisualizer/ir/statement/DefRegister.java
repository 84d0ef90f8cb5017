package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

/** A register clocked by {@code clock}. */
public final class DefRegister extends Statement {
    public final String name;
    public final Expression clock;

    public DefRegister(String name, Expression clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.clock.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("reg ")
                .append(this.name)
                .append(", ")
                .append(this.clock);
    }

    @SuppressWarnings("unused")
    public static DefRegister fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        Expression clock = fromJsonNode(node, "clock", reader, Expression.class);
        return new DefRegister(name, clock);
    }
}
