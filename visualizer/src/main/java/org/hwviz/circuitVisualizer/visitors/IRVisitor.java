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

package org.hwviz.circuitVisualizer.visitors;

import org.hwviz.circuitVisualizer.errors.IErrorReporter;
import org.hwviz.circuitVisualizer.errors.InternalCompilerError;
import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.circuitVisualizer.ir.CircuitModule;
import org.hwviz.circuitVisualizer.ir.DefModule;
import org.hwviz.circuitVisualizer.ir.ExtModule;
import org.hwviz.circuitVisualizer.ir.IRNode;
import org.hwviz.circuitVisualizer.ir.Port;
import org.hwviz.circuitVisualizer.ir.expression.DoPrim;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.ir.expression.Literal;
import org.hwviz.circuitVisualizer.ir.expression.Mux;
import org.hwviz.circuitVisualizer.ir.expression.Reference;
import org.hwviz.circuitVisualizer.ir.expression.SIntLiteral;
import org.hwviz.circuitVisualizer.ir.expression.SubAccess;
import org.hwviz.circuitVisualizer.ir.expression.SubField;
import org.hwviz.circuitVisualizer.ir.expression.SubIndex;
import org.hwviz.circuitVisualizer.ir.expression.UIntLiteral;
import org.hwviz.circuitVisualizer.ir.expression.UnsupportedExpression;
import org.hwviz.circuitVisualizer.ir.expression.ValidIf;
import org.hwviz.circuitVisualizer.ir.statement.Block;
import org.hwviz.circuitVisualizer.ir.statement.Connect;
import org.hwviz.circuitVisualizer.ir.statement.DefInstance;
import org.hwviz.circuitVisualizer.ir.statement.DefMemory;
import org.hwviz.circuitVisualizer.ir.statement.DefNode;
import org.hwviz.circuitVisualizer.ir.statement.DefRegister;
import org.hwviz.circuitVisualizer.ir.statement.DefWire;
import org.hwviz.circuitVisualizer.ir.statement.IsInvalid;
import org.hwviz.circuitVisualizer.ir.statement.Skip;
import org.hwviz.circuitVisualizer.ir.statement.Statement;
import org.hwviz.circuitVisualizer.ir.statement.UnsupportedStatement;
import org.hwviz.util.IHasId;
import org.hwviz.util.IWritesLogs;
import org.hwviz.util.Logger;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/** Depth-first traversal of an {@link IRNode} hierarchy.
 * Each preorder/postorder overload delegates by default to the overload
 * for the immediate superclass, so a visitor can handle a whole family
 * of nodes by overriding a single method. */
@SuppressWarnings({"SameReturnValue", "EmptyMethod", "unused"})
public abstract class IRVisitor implements IWritesLogs, IHasId {
    final long id;
    static long crtId = 0;
    protected final IErrorReporter errorReporter;
    protected final List<IRNode> context;

    protected IRVisitor(IErrorReporter reporter) {
        this.id = crtId++;
        this.errorReporter = reporter;
        this.context = new ArrayList<>();
    }

    @Override
    public long getId() {
        return this.id;
    }

    public void push(IRNode node) {
        this.context.add(node);
    }

    public void pop(IRNode node) {
        IRNode last = Utilities.removeLast(this.context);
        if (node != last)
            throw new InternalCompilerError("Corrupted visitor context: popping " + node
                    + " instead of " + last, node);
    }

    @Nullable
    public IRNode getParent() {
        if (this.context.isEmpty())
            return null;
        return Utilities.last(this.context);
    }

    /** Override to initialize before visiting any node. */
    public void startVisit(IRNode node) {
        Logger.INSTANCE.belowLevel(this, 4)
                .append("Starting ")
                .appendSupplier(this::toString)
                .append(" at ")
                .append(node.getClass().getSimpleName())
                .newline();
    }

    /** Override to finish after visiting all nodes. */
    public void endVisit() {}

    public IRNode apply(IRNode node) {
        this.startVisit(node);
        node.accept(this);
        this.endVisit();
        return node;
    }

    /************************* PREORDER *****************************/

    public VisitDecision preorder(IRNode ignored) {
        return VisitDecision.CONTINUE;
    }

    public VisitDecision preorder(Circuit node) {
        return this.preorder((IRNode) node);
    }

    public VisitDecision preorder(DefModule node) {
        return this.preorder((IRNode) node);
    }

    public VisitDecision preorder(CircuitModule node) {
        return this.preorder((DefModule) node);
    }

    public VisitDecision preorder(ExtModule node) {
        return this.preorder((DefModule) node);
    }

    public VisitDecision preorder(Port node) {
        return this.preorder((IRNode) node);
    }

    // Statements

    public VisitDecision preorder(Statement node) {
        return this.preorder((IRNode) node);
    }

    public VisitDecision preorder(Block node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(Connect node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(DefInstance node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(DefNode node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(DefWire node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(DefRegister node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(DefMemory node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(Skip node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(IsInvalid node) {
        return this.preorder((Statement) node);
    }

    public VisitDecision preorder(UnsupportedStatement node) {
        return this.preorder((Statement) node);
    }

    // Expressions

    public VisitDecision preorder(Expression node) {
        return this.preorder((IRNode) node);
    }

    public VisitDecision preorder(Reference node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(SubField node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(SubIndex node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(SubAccess node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Mux node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(ValidIf node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(DoPrim node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(Literal node) {
        return this.preorder((Expression) node);
    }

    public VisitDecision preorder(UIntLiteral node) {
        return this.preorder((Literal) node);
    }

    public VisitDecision preorder(SIntLiteral node) {
        return this.preorder((Literal) node);
    }

    public VisitDecision preorder(UnsupportedExpression node) {
        return this.preorder((Expression) node);
    }

    /************************* POSTORDER *****************************/

    public void postorder(IRNode ignored) {}

    public void postorder(Circuit node) {
        this.postorder((IRNode) node);
    }

    public void postorder(DefModule node) {
        this.postorder((IRNode) node);
    }

    public void postorder(CircuitModule node) {
        this.postorder((DefModule) node);
    }

    public void postorder(ExtModule node) {
        this.postorder((DefModule) node);
    }

    public void postorder(Port node) {
        this.postorder((IRNode) node);
    }

    public void postorder(Statement node) {
        this.postorder((IRNode) node);
    }

    public void postorder(Block node) {
        this.postorder((Statement) node);
    }

    public void postorder(Connect node) {
        this.postorder((Statement) node);
    }

    public void postorder(DefInstance node) {
        this.postorder((Statement) node);
    }

    public void postorder(DefNode node) {
        this.postorder((Statement) node);
    }

    public void postorder(DefWire node) {
        this.postorder((Statement) node);
    }

    public void postorder(DefRegister node) {
        this.postorder((Statement) node);
    }

    public void postorder(DefMemory node) {
        this.postorder((Statement) node);
    }

    public void postorder(Skip node) {
        this.postorder((Statement) node);
    }

    public void postorder(IsInvalid node) {
        this.postorder((Statement) node);
    }

    public void postorder(UnsupportedStatement node) {
        this.postorder((Statement) node);
    }

    public void postorder(Expression node) {
        this.postorder((IRNode) node);
    }

    public void postorder(Reference node) {
        this.postorder((Expression) node);
    }

    public void postorder(SubField node) {
        this.postorder((Expression) node);
    }

    public void postorder(SubIndex node) {
        this.postorder((Expression) node);
    }

    public void postorder(SubAccess node) {
        this.postorder((Expression) node);
    }

    public void postorder(Mux node) {
        this.postorder((Expression) node);
    }

    public void postorder(ValidIf node) {
        this.postorder((Expression) node);
    }

    public void postorder(DoPrim node) {
        this.postorder((Expression) node);
    }

    public void postorder(Literal node) {
        this.postorder((Expression) node);
    }

    public void postorder(UIntLiteral node) {
        this.postorder((Literal) node);
    }

    public void postorder(SIntLiteral node) {
        this.postorder((Literal) node);
    }

    public void postorder(UnsupportedExpression node) {
        this.postorder((Expression) node);
    }

    @Override
    public String toString() {
        return this.id + " " + this.getClass().getSimpleName();
    }
}
