package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

/** Reference to a named circuit element in the enclosing module. */
public final class Reference extends Expression {
    public final String name;

    public Reference(String name) {
        this.name = name;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @SuppressWarnings("unused")
    public static Reference fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        return new Reference(name);
    }
}
