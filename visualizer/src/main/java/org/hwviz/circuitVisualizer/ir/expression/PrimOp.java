package org.hwviz.circuitVisualizer.ir.expression;

/** Primitive operations, named by their textual circuit syntax. */
public enum PrimOp {
    ADD("add"),
    SUB("sub"),
    MUL("mul"),
    DIV("div"),
    REM("rem"),
    LT("lt"),
    LEQ("leq"),
    GT("gt"),
    GEQ("geq"),
    EQ("eq"),
    NEQ("neq"),
    PAD("pad"),
    AS_UINT("asUInt"),
    AS_SINT("asSInt"),
    AS_CLOCK("asClock"),
    AS_ASYNC_RESET("asAsyncReset"),
    SHL("shl"),
    SHR("shr"),
    DSHL("dshl"),
    DSHR("dshr"),
    CVT("cvt"),
    NEG("neg"),
    NOT("not"),
    AND("and"),
    OR("or"),
    XOR("xor"),
    ANDR("andr"),
    ORR("orr"),
    XORR("xorr"),
    CAT("cat"),
    BITS("bits"),
    HEAD("head"),
    TAIL("tail"),
    /** Any operation without a textual name above. */
    UNSUPPORTED("?");

    public final String text;

    PrimOp(String text) {
        this.text = text;
    }

    /** The operation named {@code text}; UNSUPPORTED if there is none. */
    public static PrimOp fromString(String text) {
        for (PrimOp op: PrimOp.values())
            if (op.text.equals(text))
                return op;
        return UNSUPPORTED;
    }

    @Override
    public String toString() {
        return this.text;
    }
}
