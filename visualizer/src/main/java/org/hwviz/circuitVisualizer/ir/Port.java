package org.hwviz.circuitVisualizer.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

public final class Port extends IRNode {
    public final String name;
    public final Direction direction;

    public Port(String name, Direction direction) {
        this.name = name;
        this.direction = direction;
    }

    public static Port input(String name) {
        return new Port(name, Direction.INPUT);
    }

    public static Port output(String name) {
        return new Port(name, Direction.OUTPUT);
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
        return builder.append(this.direction.toString())
                .append(" ")
                .append(this.name);
    }

    @SuppressWarnings("unused")
    public static Port fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        Direction direction = Direction.fromString(Utilities.getStringProperty(node, "direction"));
        return new Port(name, direction);
    }
}
