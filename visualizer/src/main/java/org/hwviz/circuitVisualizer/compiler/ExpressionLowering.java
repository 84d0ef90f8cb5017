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

import org.hwviz.circuitVisualizer.graph.BinaryOpNode;
import org.hwviz.circuitVisualizer.graph.LiteralNode;
import org.hwviz.circuitVisualizer.graph.ModuleNode;
import org.hwviz.circuitVisualizer.graph.MuxNode;
import org.hwviz.circuitVisualizer.graph.OneArgOneParamOpNode;
import org.hwviz.circuitVisualizer.graph.OneArgTwoParamOpNode;
import org.hwviz.circuitVisualizer.graph.UnaryOpNode;
import org.hwviz.circuitVisualizer.graph.ValidIfNode;
import org.hwviz.circuitVisualizer.ir.expression.DoPrim;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.ir.expression.Literal;
import org.hwviz.circuitVisualizer.ir.expression.Mux;
import org.hwviz.circuitVisualizer.ir.expression.Reference;
import org.hwviz.circuitVisualizer.ir.expression.SubField;
import org.hwviz.circuitVisualizer.ir.expression.SubIndex;
import org.hwviz.circuitVisualizer.ir.expression.ValidIf;
import org.hwviz.circuitVisualizer.visitors.TranslateVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.Logger;

/** Lowers the expressions of one module instance into graph nodes.
 * The translation of each expression is the reference string that an
 * edge should use to read the value of the expression.  Nodes for
 * operations, multiplexers and literals are added to the module container
 * as a side effect.  All preorder methods return STOP: sub-expressions
 * are lowered explicitly, in the order in which they are wired. */
public final class ExpressionLowering extends TranslateVisitor<String> {
    /** Reference produced for operations that cannot be drawn. */
    public static final String PLACEHOLDER = "dummy";

    final ModuleTranslator module;
    final ModuleNode container;

    public ExpressionLowering(ModuleTranslator module) {
        super(module.context.visualizer);
        this.module = module;
        this.container = module.container;
    }

    /** Lower an expression and return the reference to its value. */
    public String lower(Expression expression) {
        return this.analyze(expression);
    }

    /** Any expression kind without a more specific overload. */
    @Override
    public VisitDecision preorder(Expression node) {
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Cannot draw expression ")
                .append(node.getClass().getSimpleName())
                .append(" ")
                .append(node)
                .newline();
        this.set(node, "");
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Reference node) {
        this.set(node, this.module.resolve(node.toString()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SubField node) {
        this.set(node, this.module.resolve(node.toString()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(SubIndex node) {
        this.set(node, this.module.resolve(node.toString()));
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Mux node) {
        MuxNode mux = new MuxNode(synthetic("mux", this.container.nextSequence()), this.container);
        this.container.addChild(mux);
        this.container.connect(mux.select(), this.lower(node.cond));
        this.container.connect(mux.in1(), this.lower(node.tval));
        this.container.connect(mux.in2(), this.lower(node.fval));
        this.set(node, mux.asRhs());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(ValidIf node) {
        ValidIfNode validIf = new ValidIfNode(synthetic("validif", this.container.nextSequence()), this.container);
        this.container.addChild(validIf);
        this.container.connect(validIf.select(), this.lower(node.cond));
        this.container.connect(validIf.in1(), this.lower(node.value));
        this.set(node, validIf.asRhs());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(Literal node) {
        LiteralNode literal = new LiteralNode(
                synthetic("lit", this.module.context.nextLiteral()), node.value, this.container);
        this.container.addChild(literal);
        this.set(node, literal.asRhs());
        return VisitDecision.STOP;
    }

    @Override
    public VisitDecision preorder(DoPrim node) {
        String result = switch (node.op) {
            case ADD -> this.binary(node, "add");
            case SUB -> this.binary(node, "sub");
            case MUL -> this.binary(node, "mul");
            case DIV -> this.binary(node, "div");
            case REM -> this.binary(node, "rem");
            case EQ -> this.binary(node, "eq");
            case NEQ -> this.binary(node, "neq");
            case LT -> this.binary(node, "lt");
            case LEQ -> this.binary(node, "lte");
            case GT -> this.binary(node, "gt");
            case GEQ -> this.binary(node, "gte");
            case PAD -> this.unary(node, "pad");
            case AS_UINT -> this.unary(node, "asUInt");
            case AS_SINT -> this.unary(node, "asSInt");
            case SHL -> this.oneParam(node, "shl");
            case SHR -> this.oneParam(node, "shr");
            case DSHL -> this.binary(node, "dshl");
            case DSHR -> this.binary(node, "dshr");
            case CVT -> this.unary(node, "cvt");
            case NEG -> this.unary(node, "neg");
            case NOT -> this.unary(node, "not");
            case AND -> this.binary(node, "and");
            case OR -> this.binary(node, "or");
            case XOR -> this.binary(node, "xor");
            case ANDR -> this.unary(node, "andr");
            case ORR -> this.unary(node, "orr");
            case XORR -> this.unary(node, "xorr");
            case CAT -> this.binary(node, "cat");
            case BITS -> this.twoParams(node, "bits");
            case HEAD -> this.oneParam(node, "head");
            case TAIL -> this.oneParam(node, "tail");
            case AS_CLOCK, AS_ASYNC_RESET, UNSUPPORTED -> this.unsupported(node);
        };
        this.set(node, result);
        return VisitDecision.STOP;
    }

    /** Name of a node that has no counterpart in the circuit.  Circuit
     * identifiers never contain '#', so these cannot clash with them. */
    static String synthetic(String kind, long sequence) {
        return kind + "#" + sequence;
    }

    String opName(String symbol) {
        return synthetic("op_" + symbol, this.container.nextSequence());
    }

    /** Lower argument {@code index} of an operation; a missing argument reads nothing. */
    String argument(DoPrim node, int index) {
        if (index >= node.args.size()) {
            this.module.reportMalformed(node, "argument " + index);
            return "";
        }
        return this.lower(node.args.get(index));
    }

    long constant(DoPrim node, int index) {
        if (index >= node.consts.size()) {
            this.module.reportMalformed(node, "constant " + index);
            return 0;
        }
        return node.consts.get(index);
    }

    String binary(DoPrim node, String symbol) {
        BinaryOpNode op = new BinaryOpNode(this.opName(symbol), symbol, this.container);
        this.container.addChild(op);
        this.container.connect(op.in1(), this.argument(node, 0));
        this.container.connect(op.in2(), this.argument(node, 1));
        return op.asRhs();
    }

    String unary(DoPrim node, String symbol) {
        UnaryOpNode op = new UnaryOpNode(this.opName(symbol), symbol, this.container);
        this.container.addChild(op);
        this.container.connect(op.in1(), this.argument(node, 0));
        return op.asRhs();
    }

    String oneParam(DoPrim node, String symbol) {
        OneArgOneParamOpNode op = new OneArgOneParamOpNode(
                this.opName(symbol), symbol, this.constant(node, 0), this.container);
        this.container.addChild(op);
        this.container.connect(op.in1(), this.argument(node, 0));
        return op.asRhs();
    }

    String twoParams(DoPrim node, String symbol) {
        OneArgTwoParamOpNode op = new OneArgTwoParamOpNode(
                this.opName(symbol), symbol, this.constant(node, 0), this.constant(node, 1), this.container);
        this.container.addChild(op);
        this.container.connect(op.in1(), this.argument(node, 0));
        return op.asRhs();
    }

    String unsupported(DoPrim node) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Cannot draw operation ")
                .append(node.name)
                .newline();
        return PLACEHOLDER;
    }
}
