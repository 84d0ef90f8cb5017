package org.hwviz.circuitVisualizer.ir.statement;

import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** A statement of a kind that is not modeled, e.g., printf or stop.
 * Only the kind is kept; these statements are never drawn. */
public final class UnsupportedStatement extends Statement {
    public final String kind;

    public UnsupportedStatement(String kind) {
        this.kind = kind;
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("<")
                .append(this.kind)
                .append(">");
    }
}
