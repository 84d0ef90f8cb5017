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
import org.hwviz.circuitVisualizer.backend.ToDot;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.circuitVisualizer.graph.BinaryOpNode;
import org.hwviz.circuitVisualizer.graph.Edge;
import org.hwviz.circuitVisualizer.graph.GraphNode;
import org.hwviz.circuitVisualizer.graph.LiteralNode;
import org.hwviz.circuitVisualizer.graph.MemoryNode;
import org.hwviz.circuitVisualizer.graph.ModuleNode;
import org.hwviz.circuitVisualizer.graph.MuxNode;
import org.hwviz.circuitVisualizer.graph.NodeNode;
import org.hwviz.circuitVisualizer.graph.PortNode;
import org.hwviz.circuitVisualizer.graph.RegisterNode;
import org.hwviz.circuitVisualizer.graph.ValidIfNode;
import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.circuitVisualizer.ir.CircuitModule;
import org.hwviz.circuitVisualizer.ir.DefModule;
import org.hwviz.circuitVisualizer.ir.ExtModule;
import org.hwviz.circuitVisualizer.ir.Port;
import org.hwviz.circuitVisualizer.ir.expression.DoPrim;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.ir.expression.Mux;
import org.hwviz.circuitVisualizer.ir.expression.PrimOp;
import org.hwviz.circuitVisualizer.ir.expression.Reference;
import org.hwviz.circuitVisualizer.ir.expression.SubAccess;
import org.hwviz.circuitVisualizer.ir.expression.SubField;
import org.hwviz.circuitVisualizer.ir.expression.UIntLiteral;
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
import org.hwviz.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class CircuitVisualizerTests {
    static Reference ref(String name) {
        return new Reference(name);
    }

    static SubField field(String instance, String name) {
        return new SubField(ref(instance), name);
    }

    static Connect connect(Expression loc, Expression expr) {
        return new Connect(loc, expr);
    }

    static CircuitModule module(String name, List<Port> ports, Statement... body) {
        return new CircuitModule(name, ports, new Block(body));
    }

    static Circuit circuit(String main, DefModule... modules) {
        return new Circuit(main, Linq.list(modules));
    }

    /** Top: c = a + b */
    static Circuit adder() {
        return circuit("Top", module("Top",
                Linq.list(Port.input("a"), Port.input("b"), Port.output("c")),
                connect(ref("c"), new DoPrim(PrimOp.ADD, ref("a"), ref("b")))));
    }

    /** A module that forwards its input to its output. */
    static CircuitModule child() {
        return module("Child",
                Linq.list(Port.input("x"), Port.output("y")),
                connect(ref("y"), ref("x")));
    }

    /** Top instantiates two chained copies of Child. */
    static Circuit hierarchy(VisualizerAnnotation... annotations) {
        CircuitModule top = module("Top",
                Linq.list(Port.input("i"), Port.output("o")),
                new DefInstance("a", "Child"),
                new DefInstance("b", "Child"),
                connect(field("a", "x"), ref("i")),
                connect(field("b", "x"), field("a", "y")),
                connect(ref("o"), field("b", "y")));
        List<DefModule> modules = Linq.list(top, child());
        return new Circuit("Top", modules, Linq.list(annotations));
    }

    static ModuleNode translate(Circuit circuit) {
        return new CircuitVisualizer().translate(circuit);
    }

    static List<String> edges(ModuleNode node) {
        return Linq.map(node.getEdges(), Edge::toString);
    }

    static <T extends GraphNode> List<T> children(ModuleNode node, Class<T> clazz) {
        List<T> result = new ArrayList<>();
        for (GraphNode child: node.getChildren()) {
            T cast = child.as(clazz);
            if (cast != null)
                result.add(cast);
        }
        return result;
    }

    static ModuleNode instance(ModuleNode parent, String name) {
        ModuleNode result = Linq.first(children(parent, ModuleNode.class), m -> m.name.equals(name));
        Assert.assertNotNull(result);
        return result;
    }

    @Test
    public void adderTest() {
        Circuit circuit = adder();
        ModuleNode root = translate(circuit);
        Assert.assertEquals(3, children(root, PortNode.class).size());
        List<BinaryOpNode> ops = children(root, BinaryOpNode.class);
        Assert.assertEquals(1, ops.size());
        Assert.assertEquals("add", ops.get(0).symbol);
        Assert.assertEquals(Linq.list(
                "Top_a -> \"Top_op_add#0\":in1",
                "Top_b -> \"Top_op_add#0\":in2",
                "\"Top_op_add#0\":out -> Top_c"), edges(root));

        String dot = new ToDot(circuit.main, root).render();
        Assert.assertEquals("""
                digraph Top {
                    subgraph cluster_Top {
                        label="Top"
                        Top_a [ shape=box label="a" ]
                        Top_b [ shape=box label="b" ]
                        Top_c [ shape=box label="c" ]
                        "Top_op_add#0" [ shape=record label="{{<in1> in1|<in2> in2}|add|<out> out}" ]
                        Top_a -> "Top_op_add#0":in1;
                        Top_b -> "Top_op_add#0":in2;
                        "Top_op_add#0":out -> Top_c;
                    }
                }
                """, dot);
    }

    @Test
    public void hierarchyTest() {
        Circuit circuit = hierarchy();
        ModuleNode root = translate(circuit);
        Assert.assertEquals("""
                digraph Top {
                    subgraph cluster_Top {
                        label="Top"
                        Top_i [ shape=box label="i" ]
                        Top_o [ shape=box label="o" ]
                        subgraph cluster_Top_a {
                            label="a"
                            Top_a_x [ shape=box label="x" ]
                            Top_a_y [ shape=box label="y" ]
                            Top_a_x -> Top_a_y;
                        }
                        subgraph cluster_Top_b {
                            label="b"
                            Top_b_x [ shape=box label="x" ]
                            Top_b_y [ shape=box label="y" ]
                            Top_b_x -> Top_b_y;
                        }
                        Top_i -> Top_a_x;
                        Top_a_y -> Top_b_x;
                        Top_b_y -> Top_o;
                    }
                }
                """, new ToDot(circuit.main, root).render());
    }

    @Test
    public void idempotentTest() {
        Circuit circuit = hierarchy(VisualizerAnnotation.depth("Child", 0));
        CircuitVisualizer visualizer = new CircuitVisualizer();
        String first = new ToDot(circuit.main, visualizer.translate(circuit)).render();
        String second = new ToDot(circuit.main, visualizer.translate(circuit)).render();
        Assert.assertEquals(first, second);
    }

    @Test
    public void siblingWiresTest() {
        CircuitModule left = module("Left",
                Linq.list(Port.input("i"), Port.output("o")),
                new DefWire("x"),
                connect(ref("x"), ref("i")),
                connect(ref("o"), ref("x")));
        CircuitModule right = module("Right",
                Linq.list(Port.input("i"), Port.output("o")),
                new DefWire("x"),
                connect(ref("x"), new DoPrim(PrimOp.NOT, ref("i"))),
                connect(ref("o"), ref("x")));
        CircuitModule top = module("Top",
                Linq.list(Port.input("a")),
                new DefInstance("l", "Left"),
                new DefInstance("r", "Right"),
                connect(field("l", "i"), ref("a")),
                connect(field("r", "i"), field("l", "o")));
        ModuleNode root = translate(circuit("Top", top, left, right));

        ModuleNode l = instance(root, "l");
        ModuleNode r = instance(root, "r");
        Assert.assertEquals("Top_l_x", children(l, NodeNode.class).get(0).absoluteName());
        Assert.assertEquals("Top_r_x", children(r, NodeNode.class).get(0).absoluteName());
        Assert.assertEquals(Linq.list("Top_l_i -> Top_l_x", "Top_l_x -> Top_l_o"), edges(l));
        Assert.assertEquals(Linq.list(
                "Top_r_i -> \"Top_r_op_not#0\":in1",
                "\"Top_r_op_not#0\":out -> Top_r_x",
                "Top_r_x -> Top_r_o"), edges(r));
        Assert.assertEquals(Linq.list("Top_a -> Top_l_i", "Top_l_o -> Top_r_i"), edges(root));
    }

    @Test
    public void registerTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("in"), Port.input("clk"), Port.output("out")),
                new DefRegister("r", ref("clk")),
                connect(ref("r"), ref("in")),
                connect(ref("out"), ref("r")))));
        Assert.assertEquals(1, children(root, RegisterNode.class).size());
        Assert.assertEquals(Linq.list(
                "Top_in -> Top_r:in",
                "Top_r -> Top_out"), edges(root));
    }

    @Test
    public void nodeAndWireTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("a"), Port.output("o")),
                new DefNode("n", new DoPrim(PrimOp.NOT, ref("a"))),
                new DefWire("w"),
                connect(ref("w"), ref("n")),
                connect(ref("o"), ref("w")))));
        Assert.assertEquals(2, children(root, NodeNode.class).size());
        Assert.assertEquals(Linq.list(
                "Top_a -> \"Top_op_not#0\":in1",
                "\"Top_op_not#0\":out -> Top_n",
                "Top_n -> Top_w",
                "Top_w -> Top_o"), edges(root));
    }

    @Test
    public void muxTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("s"), Port.input("a"), Port.input("b"), Port.output("o")),
                connect(ref("o"), new Mux(ref("s"), ref("a"), ref("b"))))));
        List<MuxNode> muxes = children(root, MuxNode.class);
        Assert.assertEquals(1, muxes.size());
        Assert.assertEquals("mux#0", muxes.get(0).name);
        Assert.assertEquals(Linq.list(
                "Top_s -> \"Top_mux#0\":select",
                "Top_a -> \"Top_mux#0\":in1",
                "Top_b -> \"Top_mux#0\":in2",
                "\"Top_mux#0\":out -> Top_o"), edges(root));
    }

    @Test
    public void nestedExpressionTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("s"), Port.input("a"), Port.output("o")),
                connect(ref("o"), new DoPrim(PrimOp.ADD,
                        new ValidIf(ref("s"), ref("a")),
                        new UIntLiteral(3, 4))))));
        // The operation is named before its arguments are lowered
        Assert.assertEquals("op_add#0", children(root, BinaryOpNode.class).get(0).name);
        Assert.assertEquals("validif#1", children(root, ValidIfNode.class).get(0).name);
        LiteralNode literal = children(root, LiteralNode.class).get(0);
        Assert.assertEquals("lit#0", literal.name);
        Assert.assertEquals(3, literal.value.intValue());
        Assert.assertEquals(Linq.list(
                "Top_s -> \"Top_validif#1\":select",
                "Top_a -> \"Top_validif#1\":in1",
                "\"Top_validif#1\":out -> \"Top_op_add#0\":in1",
                "\"Top_lit#0\" -> \"Top_op_add#0\":in2",
                "\"Top_op_add#0\":out -> Top_o"), edges(root));
    }

    @Test
    public void syntheticNamesDoNotCollideTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("s"), Port.input("a"), Port.input("b"), Port.output("o")),
                new DefNode("mux_0", new Mux(ref("s"), ref("a"), ref("b"))),
                new DefNode("lit0", new UIntLiteral(1, 1)),
                connect(ref("o"), ref("mux_0")))));
        Set<String> names = new HashSet<>();
        for (GraphNode child: root.getChildren())
            Assert.assertTrue(names.add(child.absoluteName()));
        Assert.assertTrue(names.contains("Top_mux_0"));
        Assert.assertTrue(names.contains("Top_mux#0"));
        Assert.assertTrue(edges(root).contains("\"Top_mux#0\":out -> Top_mux_0"));
        Assert.assertTrue(edges(root).contains("\"Top_lit#0\" -> Top_lit0"));
        Assert.assertTrue(edges(root).contains("Top_mux_0 -> Top_o"));
    }

    @Test
    public void parameterizedOperationsTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("a"), Port.output("o"), Port.output("p")),
                connect(ref("o"), new DoPrim(PrimOp.BITS, Linq.list(ref("a")), Linq.list(7L, 4L))),
                connect(ref("p"), new DoPrim(PrimOp.SHL, Linq.list(ref("a")), Linq.list(2L))))));
        Assert.assertEquals(Linq.list(
                "Top_a -> \"Top_op_bits#0\":in1",
                "\"Top_op_bits#0\":out -> Top_o",
                "Top_a -> \"Top_op_shl#1\":in1",
                "\"Top_op_shl#1\":out -> Top_p"), edges(root));
        String dot = new ToDot("Top", root).render();
        Assert.assertTrue(dot.contains("|bits(7,\\ 4)|"));
        Assert.assertTrue(dot.contains("|shl(2)|"));
    }

    @Test
    public void literalsAreUniqueTest() {
        CircuitModule child = module("Child",
                Linq.list(Port.output("y")),
                connect(ref("y"), new UIntLiteral(1, 1)));
        CircuitModule top = module("Top",
                Linq.list(Port.output("o")),
                new DefInstance("a", "Child"),
                new DefInstance("b", "Child"),
                connect(ref("o"), new UIntLiteral(0, 1)));
        ModuleNode root = translate(circuit("Top", top, child));
        Assert.assertEquals("Top_a_lit#0", children(instance(root, "a"), LiteralNode.class).get(0).absoluteName());
        Assert.assertEquals("Top_b_lit#1", children(instance(root, "b"), LiteralNode.class).get(0).absoluteName());
        Assert.assertEquals(Linq.list("\"Top_lit#2\" -> Top_o"), edges(root));
    }

    @Test
    public void memoryTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("addr"), Port.output("data")),
                new DefMemory("mem", 32, Linq.list("r"), Linq.list("w"), new ArrayList<>()),
                connect(new SubField(field("mem", "r"), "addr"), ref("addr")),
                connect(ref("data"), new SubField(field("mem", "r"), "data")))));
        List<MemoryNode> memories = children(root, MemoryNode.class);
        Assert.assertEquals(1, memories.size());
        Assert.assertEquals(32, memories.get(0).depth);
        Assert.assertEquals(MemoryNode.READER_FIELDS.size() + MemoryNode.WRITER_FIELDS.size(),
                memories.get(0).getPorts().size());
        Assert.assertEquals(Linq.list(
                "Top_addr -> Top_mem:r_addr",
                "Top_mem:r_data -> Top_data"), edges(root));
    }

    @Test
    public void depthZeroShowsPortsTest() {
        ModuleNode root = translate(hierarchy(VisualizerAnnotation.depth("Child", 0)));
        ModuleNode a = instance(root, "a");
        Assert.assertEquals(2, children(a, PortNode.class).size());
        Assert.assertTrue(a.getEdges().isEmpty());
        // The parent still connects to the ports of the instance
        Assert.assertEquals(3, root.getEdges().size());
    }

    @Test
    public void unlimitedDepthTest() {
        ModuleNode root = translate(hierarchy());
        Assert.assertEquals(1, instance(root, "a").getEdges().size());
        Assert.assertEquals(1, instance(root, "b").getEdges().size());
    }

    @Test
    public void circuitDepthTest() {
        CircuitModule leaf = module("Leaf",
                Linq.list(Port.input("x"), Port.output("y")),
                connect(ref("y"), ref("x")));
        CircuitModule middle = module("Middle",
                Linq.list(Port.input("x"), Port.output("y")),
                new DefInstance("leaf", "Leaf"),
                new DefMemory("m", 4, Linq.list("r"), new ArrayList<>(), new ArrayList<>()),
                connect(field("leaf", "x"), ref("x")),
                connect(ref("y"), field("leaf", "y")));
        CircuitModule top = module("Top",
                Linq.list(Port.input("x"), Port.output("y")),
                new DefInstance("mid", "Middle"),
                connect(field("mid", "x"), ref("x")),
                connect(ref("y"), field("mid", "y")));
        Circuit circuit = new Circuit("Top", Linq.list(top, middle, leaf),
                Linq.list(VisualizerAnnotation.depth("Top", 1)));
        ModuleNode root = translate(circuit);

        ModuleNode mid = instance(root, "mid");
        Assert.assertEquals(2, children(mid, PortNode.class).size());
        Assert.assertTrue(mid.getEdges().isEmpty());
        // Memories are drawn even when components are not
        Assert.assertEquals(1, children(mid, MemoryNode.class).size());
        ModuleNode leafNode = instance(mid, "leaf");
        Assert.assertTrue(leafNode.getChildren().isEmpty());
        Assert.assertEquals(2, root.getEdges().size());

        // The circuit-wide depth restarts the scope below the limited Middle
        circuit = new Circuit("Top", Linq.list(top, middle, leaf),
                Linq.list(VisualizerAnnotation.depth("Middle", 3), VisualizerAnnotation.depth(0)));
        root = translate(circuit);
        mid = instance(root, "mid");
        Assert.assertEquals(2, mid.getEdges().size());
        leafNode = instance(mid, "leaf");
        Assert.assertEquals(2, children(leafNode, PortNode.class).size());
        Assert.assertTrue(leafNode.getEdges().isEmpty());
    }

    @Test
    public void rootAlwaysDrawnTest() {
        Circuit circuit = new Circuit("Top", Linq.list(adder().modules.get(0)),
                Linq.list(VisualizerAnnotation.depth("Top", 0)));
        ModuleNode root = translate(circuit);
        Assert.assertEquals(4, root.getChildren().size());
        Assert.assertEquals(3, root.getEdges().size());
    }

    @Test
    public void extModuleTest() {
        ExtModule ext = new ExtModule("Ext", Linq.list(Port.input("d"), Port.output("q")));
        CircuitModule top = module("Top",
                Linq.list(Port.input("i"), Port.output("o")),
                new DefInstance("e", "Ext"),
                connect(field("e", "d"), ref("i")),
                connect(ref("o"), field("e", "q")));
        ModuleNode root = translate(circuit("Top", top, ext));
        ModuleNode e = instance(root, "e");
        Assert.assertEquals(2, e.getChildren().size());
        Assert.assertEquals(Linq.list("Top_i -> Top_e_d", "Top_e_q -> Top_o"), edges(root));
    }

    @Test
    public void unsupportedOperationTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.input("i"), Port.output("o"), Port.output("p")),
                connect(ref("o"), new DoPrim(PrimOp.AS_CLOCK, ref("i"))),
                connect(ref("p"), new DoPrim(PrimOp.NOT, ref("i"))))));
        Assert.assertEquals(Linq.list(
                ExpressionLowering.PLACEHOLDER + " -> Top_o",
                "Top_i -> \"Top_op_not#0\":in1",
                "\"Top_op_not#0\":out -> Top_p"), edges(root));
    }

    @Test
    public void unknownExpressionTest() {
        Circuit circuit = circuit("Top", module("Top",
                Linq.list(Port.input("i"), Port.output("o")),
                connect(ref("o"), new SubAccess(ref("v"), ref("i")))));
        ModuleNode root = translate(circuit);
        Assert.assertEquals(1, root.getEdges().size());
        Assert.assertEquals("", root.getEdges().get(0).source);
        Assert.assertTrue(new ToDot("Top", root).render().contains("\"\" -> Top_o;"));
    }

    @Test
    public void ignoredStatementsTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.output("o")),
                new Skip(),
                new IsInvalid(ref("o")),
                new Block(new Skip()))));
        Assert.assertEquals(1, root.getChildren().size());
        Assert.assertTrue(root.getEdges().isEmpty());
    }

    @Test
    public void unresolvedReferenceTest() {
        ModuleNode root = translate(circuit("Top", module("Top",
                Linq.list(Port.output("o")),
                connect(ref("o"), ref("ghost")))));
        Assert.assertEquals(Linq.list("Top_ghost -> Top_o"), edges(root));
    }

    @Test
    public void badConnectTest() {
        Circuit circuit = circuit("Top", module("Top",
                Linq.list(Port.input("i")),
                connect(new SubAccess(ref("v"), ref("i")), ref("i"))));
        CircuitVisualizer visualizer = new CircuitVisualizer();
        ModuleNode root = visualizer.translate(circuit);
        Assert.assertEquals(Linq.list("Top_i -> " + ModuleTranslator.BAD_NAME), edges(root));
        Assert.assertEquals(1, visualizer.messages.warningCount());
        Assert.assertFalse(visualizer.hasErrors());
        Assert.assertEquals("Top", visualizer.messages.getMessage(0).location);
    }

    @Test
    public void strictBadConnectTest() {
        Circuit circuit = circuit("Top", module("Top",
                Linq.list(Port.input("i")),
                connect(new SubAccess(ref("v"), ref("i")), ref("i"))));
        VisualizerOptions options = new VisualizerOptions();
        options.strict = true;
        CircuitVisualizer visualizer = new CircuitVisualizer(options);
        Assert.assertThrows(CompilationError.class, () -> visualizer.translate(circuit));
    }

    @Test
    public void missingInstanceModuleTest() {
        Circuit circuit = circuit("Top", module("Top",
                Linq.list(Port.input("i")),
                new DefInstance("u", "Unknown")));
        CircuitVisualizer visualizer = new CircuitVisualizer();
        ModuleNode root = visualizer.translate(circuit);
        Assert.assertTrue(instance(root, "u").getChildren().isEmpty());
        Assert.assertEquals(1, visualizer.messages.warningCount());
        Assert.assertEquals("Missing module", visualizer.messages.getMessage(0).errorType);

        VisualizerOptions options = new VisualizerOptions();
        options.strict = true;
        CircuitVisualizer strict = new CircuitVisualizer(options);
        Assert.assertThrows(CompilationError.class, () -> strict.translate(circuit));
    }

    @Test
    public void recursiveInstanceTest() {
        Circuit direct = new Circuit("Top", Linq.list(module("Top",
                Linq.list(Port.input("i")),
                new DefInstance("me", "Top"))),
                Linq.list(VisualizerAnnotation.depth("Top", 0)));
        CircuitVisualizer visualizer = new CircuitVisualizer();
        ModuleNode root = visualizer.translate(direct);
        Assert.assertTrue(instance(root, "me").getChildren().isEmpty());
        Assert.assertEquals(1, visualizer.messages.warningCount());
        Assert.assertEquals("Recursive instance", visualizer.messages.getMessage(0).errorType);

        // A instantiates B which instantiates A
        Circuit indirect = circuit("A",
                module("A", Linq.list(Port.input("x")), new DefInstance("b", "B")),
                module("B", Linq.list(Port.input("y")), new DefInstance("a", "A")));
        visualizer = new CircuitVisualizer();
        root = visualizer.translate(indirect);
        ModuleNode b = instance(root, "b");
        Assert.assertEquals(1, children(b, PortNode.class).size());
        Assert.assertTrue(instance(b, "a").getChildren().isEmpty());
        Assert.assertEquals(1, visualizer.messages.warningCount());
        Assert.assertEquals("A.b", visualizer.messages.getMessage(0).location);

        VisualizerOptions options = new VisualizerOptions();
        options.strict = true;
        CircuitVisualizer strict = new CircuitVisualizer(options);
        Assert.assertThrows(CompilationError.class, () -> strict.translate(indirect));
    }

    @Test
    public void missingTopModuleTest() {
        Circuit circuit = circuit("Top", child());
        CompilationError error = Assert.assertThrows(CompilationError.class, () -> translate(circuit));
        Assert.assertEquals("Could not find top level module in Top", error.getMessage());
    }

    @Test
    public void malformedOperationTest() {
        CircuitVisualizer visualizer = new CircuitVisualizer();
        ModuleNode root = visualizer.translate(circuit("Top", module("Top",
                Linq.list(Port.input("a"), Port.output("o")),
                connect(ref("o"), new DoPrim(PrimOp.ADD, ref("a"))))));
        Assert.assertEquals(Linq.list(
                "Top_a -> \"Top_op_add#0\":in1",
                " -> \"Top_op_add#0\":in2",
                "\"Top_op_add#0\":out -> Top_o"), edges(root));
        Assert.assertEquals(1, visualizer.messages.warningCount());
        Assert.assertEquals("Malformed expression", visualizer.messages.getMessage(0).errorType);
    }

    @Test
    public void countsTest() {
        ModuleNode root = translate(hierarchy());
        int nodes = 0;
        int edges = root.getEdges().size();
        for (GraphNode node: root.getChildren()) {
            ModuleNode nested = node.as(ModuleNode.class);
            if (nested != null) {
                nodes += nested.getChildren().size();
                edges += nested.getEdges().size();
            } else {
                nodes++;
            }
        }
        Assert.assertEquals(6, nodes);
        Assert.assertEquals(5, edges);
    }
}
