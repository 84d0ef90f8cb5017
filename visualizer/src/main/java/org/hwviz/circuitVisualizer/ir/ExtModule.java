package org.hwviz.circuitVisualizer.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

import java.util.List;

/** An external module: only the ports are known. */
public final class ExtModule extends DefModule {
    public ExtModule(String name, List<Port> ports) {
        super(name, ports);
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Port port: this.ports)
            port.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("extmodule ")
                .append(this.name)
                .append(" :")
                .increase()
                .joinI(System.lineSeparator(), this.ports);
        return builder.decrease();
    }

    @SuppressWarnings("unused")
    public static ExtModule fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        List<Port> ports = fromJsonList(node, "ports", reader, Port.class);
        return new ExtModule(name, ports);
    }
}
