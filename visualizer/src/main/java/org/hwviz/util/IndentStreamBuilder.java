package org.hwviz.util;

/** An indent stream that accumulates its output in memory; use toString() to retrieve it. */
public class IndentStreamBuilder extends IndentStream {
    public IndentStreamBuilder() {
        super(new StringBuilder());
    }
}
