package org.hwviz.circuitVisualizer.ir.statement;

import org.hwviz.circuitVisualizer.ir.IRNode;

/** Base class for statements appearing in a module body. */
public abstract class Statement extends IRNode {
    protected Statement() {}
}
