package org.hwviz.circuitVisualizer.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.circuitVisualizer.visitors.VisitDecision;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Linq;
import org.hwviz.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** Application of a primitive operation to expression arguments and integer constants. */
public final class DoPrim extends Expression {
    public final PrimOp op;
    /** Name of the operation as written; differs from the op text for unsupported operations. */
    public final String name;
    public final List<Expression> args;
    public final List<Long> consts;

    public DoPrim(String name, List<Expression> args, List<Long> consts) {
        this.op = PrimOp.fromString(name);
        this.name = name;
        this.args = args;
        this.consts = consts;
    }

    public DoPrim(PrimOp op, List<Expression> args, List<Long> consts) {
        this(op.text, args, consts);
    }

    public DoPrim(PrimOp op, Expression... args) {
        this(op, Linq.list(args), new ArrayList<>());
    }

    @Override
    public void accept(IRVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (Expression arg: this.args)
            arg.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.name)
                .append("(")
                .joinI(", ", this.args);
        for (Long c: this.consts)
            builder.append(", ").append(c);
        return builder.append(")");
    }

    @SuppressWarnings("unused")
    public static DoPrim fromJson(JsonNode node, CircuitJsonReader reader) {
        String op = Utilities.getStringProperty(node, "op");
        List<Expression> args = fromJsonList(node, "args", reader, Expression.class);
        List<Long> consts = new ArrayList<>();
        JsonNode c = node.get("consts");
        if (c != null)
            consts = Linq.map(c.elements(), JsonNode::asLong);
        return new DoPrim(op, args, consts);
    }
}
