package org.hwviz.circuitVisualizer.compiler;

import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** State shared by all the module translations of one circuit. */
public final class TranslationContext {
    public final CircuitVisualizer visualizer;
    public final Circuit circuit;
    public final NameTable names;
    long literalCount;
    /** Modules whose translation is in progress, outermost first. */
    final List<String> translating;

    public TranslationContext(CircuitVisualizer visualizer, Circuit circuit) {
        this.visualizer = visualizer;
        this.circuit = circuit;
        this.names = new NameTable();
        this.literalCount = 0;
        this.translating = new ArrayList<>();
    }

    /** Number used to name the next literal; never repeats within a translation. */
    public long nextLiteral() {
        return this.literalCount++;
    }

    /** True if an instance of this module encloses the one being translated. */
    public boolean isTranslating(String module) {
        return this.translating.contains(module);
    }

    void enter(String module) {
        this.translating.add(module);
    }

    void exit(String module) {
        String last = Utilities.removeLast(this.translating);
        Utilities.enforce(last.equals(module), "Exiting " + module + " while translating " + last);
    }
}
