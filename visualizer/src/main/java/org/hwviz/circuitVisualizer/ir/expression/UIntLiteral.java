package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;

import java.math.BigInteger;

/** An unsigned integer constant. */
public final class UIntLiteral extends Literal {
    public UIntLiteral(BigInteger value, int width) {
        super(value, width);
    }

    public UIntLiteral(long value, int width) {
        this(BigInteger.valueOf(value), width);
    }

    @Override
    protected String typeName() {
        return "UInt";
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
    public static UIntLiteral fromJson(JsonNode node, CircuitJsonReader reader) {
        return new UIntLiteral(getValue(node), getWidth(node));
    }
}
