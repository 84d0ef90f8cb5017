package org.hwviz.circuitVisualizer.visitors;

import org.hwviz.circuitVisualizer.errors.CompilerMessages;
import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.circuitVisualizer.ir.CircuitModule;
import org.hwviz.circuitVisualizer.ir.DefModule;
import org.hwviz.circuitVisualizer.ir.ExtModule;
import org.hwviz.circuitVisualizer.ir.IRNode;
import org.hwviz.circuitVisualizer.ir.Port;
import org.hwviz.circuitVisualizer.ir.expression.DoPrim;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.ir.expression.PrimOp;
import org.hwviz.circuitVisualizer.ir.expression.Reference;
import org.hwviz.circuitVisualizer.ir.statement.Block;
import org.hwviz.circuitVisualizer.ir.statement.Connect;
import org.hwviz.circuitVisualizer.ir.statement.Skip;
import org.hwviz.circuitVisualizer.ir.statement.Statement;
import org.hwviz.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class IRVisitorTest {
    /** Counts statements and ports, and records the parent of each connection. */
    static class Counter extends IRVisitor {
        int statements = 0;
        int ports = 0;
        int references = 0;
        final List<String> connectParents = new ArrayList<>();
        int visits = 0;

        Counter() {
            super(new CompilerMessages());
        }

        @Override
        public void startVisit(IRNode node) {
            super.startVisit(node);
            this.visits++;
        }

        @Override
        public VisitDecision preorder(Statement node) {
            this.statements++;
            return VisitDecision.CONTINUE;
        }

        @Override
        public VisitDecision preorder(Connect node) {
            IRNode parent = this.getParent();
            Assert.assertNotNull(parent);
            this.connectParents.add(parent.getClass().getSimpleName());
            return super.preorder(node);
        }

        @Override
        public void postorder(Port node) {
            this.ports++;
        }

        @Override
        public VisitDecision preorder(Expression node) {
            return VisitDecision.STOP;
        }

        @Override
        public void postorder(Reference node) {
            this.references++;
        }
    }

    @Test
    public void traversalTest() {
        CircuitModule top = new CircuitModule("Top",
                Linq.list(Port.input("a"), Port.output("b")),
                new Block(
                        new Connect(new Reference("b"), new DoPrim(PrimOp.NOT, new Reference("a"))),
                        new Skip()));
        ExtModule ext = new ExtModule("Ext", Linq.list(Port.input("x")));
        List<DefModule> modules = Linq.list(top, ext);
        Circuit circuit = new Circuit("Top", modules);

        Counter counter = new Counter();
        Assert.assertSame(circuit, counter.apply(circuit));
        Assert.assertEquals(1, counter.visits);
        // Block, Connect and Skip
        Assert.assertEquals(3, counter.statements);
        Assert.assertEquals(3, counter.ports);
        Assert.assertEquals(Linq.list("Block"), counter.connectParents);
        // Expressions are not entered
        Assert.assertEquals(0, counter.references);
        Assert.assertNull(counter.getParent());
    }
}
