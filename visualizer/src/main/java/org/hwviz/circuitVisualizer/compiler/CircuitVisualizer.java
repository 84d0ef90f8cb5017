/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.hwviz.circuitVisualizer.compiler;

import org.hwviz.circuitVisualizer.annotation.VisualizerAnnotation;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.circuitVisualizer.errors.CompilerMessages;
import org.hwviz.circuitVisualizer.errors.IErrorReporter;
import org.hwviz.circuitVisualizer.graph.ModuleNode;
import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.circuitVisualizer.ir.DefModule;
import org.hwviz.util.IWritesLogs;
import org.hwviz.util.Linq;
import org.hwviz.util.Logger;

import java.util.ArrayList;
import java.util.List;

/** Translates a circuit into a graph of nested module containers.
 * This object owns the options, the messages reported, and the
 * annotations that control how deep module instances are expanded. */
public class CircuitVisualizer implements IWritesLogs, IErrorReporter {
    public static final String DEFAULT_DOT_PROGRAM = "dot";
    public static final String DEFAULT_OPEN_PROGRAM = "open";

    public final VisualizerOptions options;
    public final CompilerMessages messages;
    /** Depth annotations, in the order in which they are searched. */
    final List<VisualizerAnnotation> depthAnnotations;
    String dotProgram;
    String openProgram;

    public CircuitVisualizer(VisualizerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages();
        this.messages.quiet = options.quiet;
        this.messages.emitJson = options.emitJsonErrors;
        this.depthAnnotations = new ArrayList<>();
        this.dotProgram = DEFAULT_DOT_PROGRAM;
        this.openProgram = DEFAULT_OPEN_PROGRAM;
    }

    public CircuitVisualizer() {
        this(new VisualizerOptions());
    }

    public boolean isStrict() {
        return this.options.strict;
    }

    public String getDotProgram() {
        return this.dotProgram;
    }

    public String getOpenProgram() {
        return this.openProgram;
    }

    public List<VisualizerAnnotation> getDepthAnnotations() {
        return this.depthAnnotations;
    }

    /** Sort the annotations of the options and of the circuit.
     * Program annotations are consumed here; the last one of each kind wins,
     * and programs given in the options override those given by the circuit. */
    void collectAnnotations(Circuit circuit) {
        this.depthAnnotations.clear();
        this.dotProgram = DEFAULT_DOT_PROGRAM;
        this.openProgram = DEFAULT_OPEN_PROGRAM;

        List<VisualizerAnnotation> all = new ArrayList<>(this.options.getAnnotations(circuit.main, this));
        all.addAll(circuit.annotations);
        for (VisualizerAnnotation annotation: all) {
            switch (annotation.getKind()) {
                case DEPTH -> this.depthAnnotations.add(annotation);
                case DOT_PROGRAM -> this.dotProgram = annotation.getArgument();
                case OPEN_PROGRAM -> this.openProgram = annotation.getArgument();
                case UNKNOWN -> this.reportWarning("", "Unknown annotation",
                        "Ignoring annotation " + annotation);
            }
        }
        String dot = this.options.getDotProgram();
        if (dot != null)
            this.dotProgram = dot;
        String open = this.options.getOpenProgram();
        if (open != null)
            this.openProgram = open;
    }

    /** The module with the specified name.
     * @throws CompilationError if the circuit does not contain such a module. */
    public DefModule findModule(String moduleName, Circuit circuit) {
        DefModule module = circuit.getModule(moduleName);
        if (module == null)
            throw new CompilationError("Could not find top level module in " + moduleName);
        return module;
    }

    /** Scope of an instance of module {@code moduleName} nested in an instance with scope {@code current}.
     * The first depth annotation that targets the module restarts the scope with its depth.
     * Without one, the first circuit-wide depth annotation does the same, but only when
     * {@code current} already has a depth limit.  Otherwise the instance is one level
     * deeper than its parent. */
    public Scope getScope(String moduleName, Scope current) {
        VisualizerAnnotation applicable = Linq.first(
                this.depthAnnotations, a -> a.targetsModule(moduleName));
        if (applicable == null && !current.isUnlimited())
            applicable = Linq.first(this.depthAnnotations, VisualizerAnnotation::targetsCircuit);
        if (applicable == null)
            return current.descend();
        Scope result = new Scope(0, applicable.getDepth());
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Scope of ")
                .append(moduleName)
                .append(" set to ")
                .append(result.toString())
                .append(" by ")
                .append(applicable.toString())
                .newline();
        return result;
    }

    /** Translate a circuit, starting from its top module.
     * @return The container for the top module, holding the whole graph. */
    public ModuleNode translate(Circuit circuit) {
        this.collectAnnotations(circuit);
        DefModule top = this.findModule(circuit.main, circuit);
        ModuleNode root = new ModuleNode(circuit.main, null);
        TranslationContext context = new TranslationContext(this, circuit);
        Scope scope = this.getScope(top.name, Scope.DEFAULT);
        ModuleTranslator translator = new ModuleTranslator(context, "", root, scope, true);
        translator.translate(top);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Declared ")
                .append(context.names.size())
                .append(" names")
                .newline();
        return root;
    }

    @Override
    public void reportProblem(String location, boolean warning, String errorType, String message) {
        this.messages.reportProblem(location, warning, errorType, message);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.hasErrors();
    }
}
