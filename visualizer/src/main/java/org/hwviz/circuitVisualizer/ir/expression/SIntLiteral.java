package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;

import java.math.BigInteger;

/** A signed integer constant. */
public final class SIntLiteral extends Literal {
    public SIntLiteral(BigInteger value, int width) {
        super(value, width);
    }

    public SIntLiteral(long value, int width) {
        this(BigInteger.valueOf(value), width);
    }

    @Override
    protected String typeName() {
        return "SInt";
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @SuppressWarnings("unused")
    public static SIntLiteral fromJson(JsonNode node, CircuitJsonReader reader) {
        return new SIntLiteral(getValue(node), getWidth(node));
    }
}
