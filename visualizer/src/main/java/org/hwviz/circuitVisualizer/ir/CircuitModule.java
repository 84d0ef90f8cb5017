package org.hwviz.circuitVisualizer.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.ir.statement.Statement;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

import java.util.List;

/** A module with ports and a body of statements. */
public final class CircuitModule extends DefModule {
    public final Statement body;

    public CircuitModule(String name, List<Port> ports, Statement body) {
        super(name, ports);
        this.body = body;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Port port: this.ports)
            port.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("module ")
                .append(this.name)
                .append(" :")
                .increase()
                .intercalateI(System.lineSeparator(), this.ports)
                .append(this.body)
                .decrease();
    }

    @SuppressWarnings("unused")
    public static CircuitModule fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        List<Port> ports = fromJsonList(node, "ports", reader, Port.class);
        Statement body = fromJsonNode(node, "body", reader, Statement.class);
        return new CircuitModule(name, ports, body);
    }
}
