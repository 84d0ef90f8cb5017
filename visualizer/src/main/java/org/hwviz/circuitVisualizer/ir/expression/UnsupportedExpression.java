package org.hwviz.circuitVisualizer.ir.expression;

import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;

/** An expression of a kind that is not modeled; only the kind is kept. */
public final class UnsupportedExpression extends Expression {
    public final String kind;

    public UnsupportedExpression(String kind) {
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
