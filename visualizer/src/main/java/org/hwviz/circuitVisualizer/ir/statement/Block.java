package org.hwviz.circuitVisualizer.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Linq;

import java.util.List;

/** A sequence of statements, executed in order. */
public final class Block extends Statement {
    public final List<Statement> stmts;

    public Block(List<Statement> stmts) {
        this.stmts = stmts;
    }

    public Block(Statement... stmts) {
        this(Linq.list(stmts));
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Statement stat: this.stmts)
            stat.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.joinI(System.lineSeparator(), this.stmts);
    }

    @SuppressWarnings("unused")
    public static Block fromJson(JsonNode node, CircuitJsonReader reader) {
        List<Statement> stmts = fromJsonList(node, "stmts", reader, Statement.class);
        return new Block(stmts);
    }
}
