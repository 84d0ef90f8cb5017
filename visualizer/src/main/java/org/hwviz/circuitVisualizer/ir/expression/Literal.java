package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

import java.math.BigInteger;

/** An integer constant.  A negative width stands for an inferred width. */
public abstract class Literal extends Expression {
    public final BigInteger value;
    public final int width;

    protected Literal(BigInteger value, int width) {
        this.value = value;
        this.width = width;
    }

    protected abstract String typeName();

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.typeName());
        if (this.width >= 0)
            builder.append("<").append(this.width).append(">");
        return builder.append("(")
                .append(this.value.toString())
                .append(")");
    }

    static BigInteger getValue(JsonNode node) {
        String text = Utilities.getStringProperty(node, "value");
        try {
            return new BigInteger(text);
        } catch (NumberFormatException ex) {
            throw new CompilationError("Illegal literal value " + Utilities.singleQuote(text), ex);
        }
    }

    static int getWidth(JsonNode node) {
        JsonNode width = node.get("width");
        if (width == null)
            return -1;
        return width.asInt();
    }
}
