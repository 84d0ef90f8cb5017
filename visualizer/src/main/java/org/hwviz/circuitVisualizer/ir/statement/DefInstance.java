package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

/** Instantiate module {@code module} under the local name {@code name}. */
public final class DefInstance extends Statement {
    public final String name;
    public final String module;

    public DefInstance(String name, String module) {
        this.name = name;
        this.module = module;
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
        return builder.append("inst ")
                .append(this.name)
                .append(" of ")
                .append(this.module);
    }

    @SuppressWarnings("unused")
    public static DefInstance fromJson(JsonNode node, CircuitJsonReader reader) {
        String name = Utilities.getStringProperty(node, "name");
        String module = Utilities.getStringProperty(node, "module");
        return new DefInstance(name, module);
    }
}
