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

import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.circuitVisualizer.graph.GraphNode;
import org.hwviz.circuitVisualizer.graph.MemoryNode;
import org.hwviz.circuitVisualizer.graph.MemoryPort;
import org.hwviz.circuitVisualizer.graph.ModuleNode;
import org.hwviz.circuitVisualizer.graph.NodeNode;
import org.hwviz.circuitVisualizer.graph.PortNode;
import org.hwviz.circuitVisualizer.graph.RegisterNode;
import org.hwviz.circuitVisualizer.ir.CircuitModule;
import org.hwviz.circuitVisualizer.ir.DefModule;
import org.hwviz.circuitVisualizer.ir.Direction;
import org.hwviz.circuitVisualizer.ir.IRNode;
import org.hwviz.circuitVisualizer.ir.Port;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.ir.expression.Reference;
import org.hwviz.circuitVisualizer.ir.expression.SubField;
import org.hwviz.circuitVisualizer.ir.expression.SubIndex;
import org.hwviz.circuitVisualizer.ir.statement.Block;
import org.hwviz.circuitVisualizer.ir.statement.Connect;
import org.hwviz.circuitVisualizer.ir.statement.DefInstance;
import org.hwviz.circuitVisualizer.ir.statement.DefMemory;
import org.hwviz.circuitVisualizer.ir.statement.DefNode;
import org.hwviz.circuitVisualizer.ir.statement.DefRegister;
import org.hwviz.circuitVisualizer.ir.statement.DefWire;
import org.hwviz.circuitVisualizer.ir.statement.Statement;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.Logger;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;

/** Translates the body of one module instance into the nodes and edges
 * of a {@link ModuleNode}.  Module instances are translated recursively,
 * each by its own translator.  Elements are declared in the shared
 * {@link NameTable} under their fully-qualified name, i.e., the
 * dot-separated path of instance names followed by the element name. */
public final class ModuleTranslator extends IRVisitor {
    /** Sink used for connections whose target cannot be drawn. */
    public static final String BAD_NAME = "badName";

    final TranslationContext context;
    /** Qualification of the names declared in this instance; empty for the top module. */
    final String prefix;
    final ModuleNode container;
    final Scope scope;
    /** The top module always shows its ports and components. */
    final boolean root;
    final ExpressionLowering lowering;

    public ModuleTranslator(TranslationContext context, String prefix,
                            ModuleNode container, Scope scope, boolean root) {
        super(context.visualizer);
        this.context = context;
        this.prefix = prefix;
        this.container = container;
        this.scope = scope;
        this.root = root;
        this.lowering = new ExpressionLowering(this);
    }

    public void translate(DefModule module) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Translating ")
                .append(this.location())
                .append(" (")
                .append(module.name)
                .append(") in ")
                .append(this.scope.toString())
                .newline();
        this.context.enter(module.name);
        if (this.doPorts()) {
            this.ports(module.getPorts(Direction.INPUT));
            this.ports(module.getPorts(Direction.OUTPUT));
        }
        CircuitModule withBody = module.as(CircuitModule.class);
        if (withBody != null)
            withBody.body.accept(this);
        this.context.exit(module.name);
    }

    boolean doPorts() {
        return this.root || this.scope.doPorts();
    }

    boolean doComponents() {
        return this.root || this.scope.doComponents();
    }

    void ports(List<Port> ports) {
        for (Port port: ports) {
            PortNode node = new PortNode(port.name, this.container);
            this.context.names.declare(this.qualify(port.name), node);
            this.container.addChild(node);
        }
    }

    /** Fully-qualified name of an element of this instance. */
    String qualify(String name) {
        if (this.prefix.isEmpty())
            return name;
        return this.prefix + "." + name;
    }

    /** Graphviz name of an element of this instance that has no node. */
    String expand(String name) {
        return GraphNode.quoteId(Utilities.flattenName(this.container.absoluteName() + "_" + name));
    }

    /** Reference to the driver of a local access path. */
    String resolve(String path) {
        return this.context.names.resolve(this.qualify(path), this.expand(path));
    }

    /** Name of this instance used in messages. */
    String location() {
        if (this.prefix.isEmpty())
            return this.context.circuit.main;
        return this.context.circuit.main + "." + this.prefix;
    }

    void reportMalformed(IRNode node, String missing) {
        this.errorReporter.reportWarning(this.location(), "Malformed expression",
                "Missing " + missing + " in " + node);
    }

    void declare(String name, GraphNode node) {
        this.context.names.declare(this.qualify(name), node);
        this.container.addChild(node);
    }

    /** Any statement kind without a more specific overload is not drawn. */
    @Override
    public VisitDecision preorder(Statement node) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Ignoring ")
                .append(node.getClass().getSimpleName())
                .append(" ")
                .append(node)
                .newline();
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Block node) {
        return VisitDecision.CONTINUE;
    }

    /** Access path of a connection sink, or null if the sink is not an access path. */
    @Nullable
    static String sinkPath(Expression loc) {
        if (loc.is(Reference.class) || loc.is(SubField.class) || loc.is(SubIndex.class))
            return loc.toString();
        return null;
    }

    @Override
    public VisitDecision preorder(Connect node) {
        if (!this.doComponents())
            return VisitDecision.STOP;
        String path = sinkPath(node.loc);
        String qualified;
        String dotName;
        if (path == null) {
            if (this.context.visualizer.isStrict())
                throw new CompilationError("Cannot draw connection to " + node.loc +
                        " in " + this.location());
            this.errorReporter.reportWarning(this.location(), "Bad connect",
                    "Found bad connect sink " + node.loc);
            qualified = BAD_NAME;
            dotName = BAD_NAME;
        } else {
            qualified = this.qualify(path);
            dotName = this.expand(path);
        }
        GraphNode target = this.context.names.lookup(qualified);
        String sink;
        if (target != null && target.is(RegisterNode.class))
            sink = target.to(RegisterNode.class).in();
        else if (target != null && target.is(MemoryPort.class))
            sink = target.dotId();
        else
            sink = dotName;
        this.container.connect(sink, this.lowering.lower(node.expr));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DefInstance node) {
        ModuleNode instance = new ModuleNode(node.name, this.container);
        this.container.addChild(instance);
        DefModule module = this.context.circuit.getModule(node.module);
        if (module == null) {
            if (this.context.visualizer.isStrict())
                throw new CompilationError("Could not find module " + Utilities.singleQuote(node.module) +
                        " instantiated as " + node.name + " in " + this.location());
            this.errorReporter.reportWarning(this.location(), "Missing module",
                    "Could not find module " + Utilities.singleQuote(node.module) +
                    " instantiated as " + node.name);
            return VisitDecision.STOP;
        }
        if (this.context.isTranslating(module.name)) {
            String message = "Module " + Utilities.singleQuote(module.name) +
                    " instantiated as " + node.name + " inside an instance of itself";
            if (this.context.visualizer.isStrict())
                throw new CompilationError(message + " in " + this.location());
            this.errorReporter.reportWarning(this.location(), "Recursive instance", message);
            return VisitDecision.STOP;
        }
        Scope childScope = this.context.visualizer.getScope(node.module, this.scope);
        ModuleTranslator child = new ModuleTranslator(
                this.context, this.qualify(node.name), instance, childScope, false);
        child.translate(module);
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DefNode node) {
        if (!this.doComponents())
            return VisitDecision.STOP;
        NodeNode value = new NodeNode(node.name, this.container);
        this.declare(node.name, value);
        this.container.connect(this.expand(node.name), this.lowering.lower(node.value));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DefWire node) {
        if (this.doComponents())
            this.declare(node.name, new NodeNode(node.name, this.container));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DefRegister node) {
        if (this.doComponents())
            this.declare(node.name, new RegisterNode(node.name, this.container));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DefMemory node) {
        // Memories are drawn regardless of the scope
        MemoryNode memory = new MemoryNode(node.name, node.depth, this.container);
        for (String reader: node.readers)
            this.declarePorts(node.name, memory.addPort(reader, MemoryNode.READER_FIELDS));
        for (String writer: node.writers)
            this.declarePorts(node.name, memory.addPort(writer, MemoryNode.WRITER_FIELDS));
        for (String readwriter: node.readwriters)
            this.declarePorts(node.name, memory.addPort(readwriter, MemoryNode.READWRITER_FIELDS));
        this.container.addChild(memory);
        this.context.names.declare(this.qualify(node.name), memory);
        return VisitDecision.STOP;
    }

    void declarePorts(String memory, List<MemoryPort> ports) {
        for (MemoryPort port: ports)
            this.context.names.declare(
                    this.qualify(memory + "." + port.port + "." + port.field), port);
    }

    @Override
    public String toString() {
        return super.toString() + " " + this.location();
    }
}
