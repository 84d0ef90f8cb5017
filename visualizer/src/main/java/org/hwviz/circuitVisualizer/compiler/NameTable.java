package org.hwviz.circuitVisualizer.compiler;

import org.hwviz.circuitVisualizer.graph.GraphNode;
import org.hwviz.util.IWritesLogs;
import org.hwviz.util.Logger;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Maps the fully-qualified name of a circuit element (e.g., {@code inst.reg})
 * to the graph node that drives it.  There is one table per translation. */
public final class NameTable implements IWritesLogs {
    final Map<String, GraphNode> nameToNode;

    public NameTable() {
        this.nameToNode = new HashMap<>();
    }

    /** Record the node for a name, replacing any previous declaration. */
    public void declare(String qualifiedName, GraphNode node) {
        GraphNode previous = this.nameToNode.put(qualifiedName, node);
        if (previous != null) {
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Redeclared ")
                    .append(qualifiedName)
                    .append(": ")
                    .appendSupplier(previous::toString)
                    .append(" replaced by ")
                    .appendSupplier(node::toString)
                    .newline();
        }
    }

    /** The reference of the node declared for a name; the fallback if there is none. */
    public String resolve(String qualifiedName, String fallback) {
        GraphNode node = this.nameToNode.get(qualifiedName);
        if (node == null) {
            Logger.INSTANCE.belowLevel(this, 2)
                    .append("Unresolved ")
                    .append(qualifiedName)
                    .append(", using ")
                    .append(fallback)
                    .newline();
            return fallback;
        }
        return node.asRhs();
    }

    @Nullable
    public GraphNode lookup(String qualifiedName) {
        return this.nameToNode.get(qualifiedName);
    }

    public int size() {
        return this.nameToNode.size();
    }
}
