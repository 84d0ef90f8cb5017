package org.hwviz.circuitVisualizer.annotation;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;

/** A directive attached to a circuit or to one of its modules,
 * written as {@code Key=value}.  Recognized keys are {@code Depth},
 * which limits how deep module instances are expanded, and
 * {@code DotProgram}/{@code OpenProgram}, which choose the programs
 * used to draw and to display the result. */
public final class VisualizerAnnotation {
    public enum Kind {
        DEPTH("Depth"),
        DOT_PROGRAM("DotProgram"),
        OPEN_PROGRAM("OpenProgram"),
        UNKNOWN("");

        public final String key;

        Kind(String key) {
            this.key = key;
        }
    }

    /** Program name that disables a post-processing step. */
    public static final String NONE = "none";

    /** Module targeted by the annotation; null when the annotation targets the whole circuit. */
    @Nullable
    public final String module;
    public final String value;

    public VisualizerAnnotation(@Nullable String module, String value) {
        this.module = module;
        this.value = value;
    }

    public static VisualizerAnnotation depth(@Nullable String module, int depth) {
        return new VisualizerAnnotation(module, Kind.DEPTH.key + "=" + depth);
    }

    public static VisualizerAnnotation depth(int depth) {
        return depth(null, depth);
    }

    public static VisualizerAnnotation dotProgram(String program) {
        return new VisualizerAnnotation(null, Kind.DOT_PROGRAM.key + "=" + program);
    }

    public static VisualizerAnnotation openProgram(String program) {
        return new VisualizerAnnotation(null, Kind.OPEN_PROGRAM.key + "=" + program);
    }

    public Kind getKind() {
        for (Kind kind: Kind.values()) {
            if (kind != Kind.UNKNOWN && this.value.startsWith(kind.key + "="))
                return kind;
        }
        return Kind.UNKNOWN;
    }

    public boolean is(Kind kind) {
        return this.getKind() == kind;
    }

    public boolean targetsCircuit() {
        return this.module == null;
    }

    public boolean targetsModule(String name) {
        return name.equals(this.module);
    }

    /** The text after the first '=' sign, trimmed. */
    public String getArgument() {
        int index = this.value.indexOf('=');
        if (index < 0)
            return "";
        return this.value.substring(index + 1).trim();
    }

    public int getDepth() {
        Utilities.enforce(this.is(Kind.DEPTH), "Not a depth annotation: " + this);
        String argument = this.getArgument();
        try {
            return Integer.parseInt(argument);
        } catch (NumberFormatException ex) {
            throw new CompilationError("Illegal depth in annotation " + this, ex);
        }
    }

    public static VisualizerAnnotation fromJson(JsonNode node) {
        JsonNode module = node.get("module");
        String value = Utilities.getStringProperty(node, "value");
        return new VisualizerAnnotation(module == null ? null : module.asText(), value);
    }

    @Override
    public String toString() {
        return (this.module == null ? "<circuit>" : this.module) + ": " + this.value;
    }
}
