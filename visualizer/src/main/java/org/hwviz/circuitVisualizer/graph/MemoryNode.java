package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;
import org.hwviz.util.Linq;
import org.hwviz.util.Utilities;

import java.util.ArrayList;
import java.util.List;

/** A memory, drawn as an HTML-like table with one row per memory port
 * and one addressable cell per port field. */
public final class MemoryNode extends GraphNode {
    public static final List<String> READER_FIELDS = Linq.list("en", "addr", "data", "clk");
    public static final List<String> WRITER_FIELDS = Linq.list("en", "addr", "data", "mask", "clk");
    public static final List<String> READWRITER_FIELDS =
            Linq.list("en", "addr", "wdata", "wmask", "wmode", "rdata", "clk");

    public final long depth;
    final List<String> portNames;
    /** Ports in declaration order: readers, writers, then read-writers. */
    final List<MemoryPort> ports;

    public MemoryNode(String name, long depth, ModuleNode parent) {
        super(name, parent);
        this.depth = depth;
        this.portNames = new ArrayList<>();
        this.ports = new ArrayList<>();
    }

    /** Add a memory port with the specified fields.
     * @return The terminals created, one per field. */
    public List<MemoryPort> addPort(String port, List<String> fields) {
        this.portNames.add(port);
        List<MemoryPort> result = Linq.map(fields, f -> new MemoryPort(this, port, f));
        this.ports.addAll(result);
        return result;
    }

    public List<MemoryPort> getPorts() {
        return this.ports;
    }

    @Override
    public void render(IIndentStream stream) {
        stream.append(this.dotId())
                .append(" [ shape=none margin=0 label=<")
                .increase()
                .append("<TABLE BORDER=\"0\" CELLBORDER=\"1\" CELLSPACING=\"0\">")
                .increase()
                .append("<TR><TD><B>")
                .append(Utilities.escapeHtml(this.name))
                .append("</B></TD><TD>depth ")
                .append(this.depth)
                .append("</TD></TR>");
        for (String portName: this.portNames) {
            stream.newline()
                    .append("<TR><TD>")
                    .append(Utilities.escapeHtml(portName))
                    .append("</TD>");
            for (MemoryPort port: this.ports) {
                if (!port.port.equals(portName))
                    continue;
                stream.append("<TD PORT=\"")
                        .append(port.name)
                        .append("\">")
                        .append(Utilities.escapeHtml(port.field))
                        .append("</TD>");
            }
            stream.append("</TR>");
        }
        stream.decrease()
                .newline()
                .append("</TABLE>")
                .decrease()
                .newline()
                .append("> ]")
                .newline();
    }
}
