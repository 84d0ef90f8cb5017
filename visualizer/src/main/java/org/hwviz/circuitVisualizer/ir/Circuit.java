package org.hwviz.circuitVisualizer.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.annotation.VisualizerAnnotation;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Linq;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** An elaborated circuit: a set of modules and the name of the top module. */
public final class Circuit extends IRNode {
    public final String main;
    public final List<DefModule> modules;
    /** Annotations carried by the circuit, in the order they were declared. */
    public final List<VisualizerAnnotation> annotations;

    public Circuit(String main, List<DefModule> modules, List<VisualizerAnnotation> annotations) {
        this.main = main;
        this.modules = modules;
        this.annotations = annotations;
    }

    public Circuit(String main, List<DefModule> modules) {
        this(main, modules, new ArrayList<>());
    }

    /** The module with the specified name, or null if there is none. */
    @Nullable
    public DefModule getModule(String name) {
        return Linq.first(this.modules, m -> m.name.equals(name));
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (DefModule module: this.modules)
            module.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("circuit ")
                .append(this.main)
                .append(" :")
                .increase();
        for (DefModule module: this.modules) {
            builder.append(module).newline();
        }
        return builder.decrease();
    }

    @SuppressWarnings("unused")
    public static Circuit fromJson(JsonNode node, CircuitJsonReader reader) {
        String main = Utilities.getStringProperty(node, "main");
        List<DefModule> modules = fromJsonList(node, "modules", reader, DefModule.class);
        List<VisualizerAnnotation> annotations = new ArrayList<>();
        JsonNode annos = node.get("annotations");
        if (annos != null)
            annotations = Linq.map(annos.elements(), VisualizerAnnotation::fromJson);
        return new Circuit(main, modules, annotations);
    }
}
