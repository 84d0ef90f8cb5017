package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.IIndentStream;

/** One field of a memory port, e.g., the address of reader {@code r}.
 * Memory ports are drawn as cells of their {@link MemoryNode}. */
public final class MemoryPort extends GraphNode {
    public final MemoryNode memory;
    /** Name of the memory port (reader, writer or read-writer). */
    public final String port;
    public final String field;

    public MemoryPort(MemoryNode memory, String port, String field) {
        super(port + "_" + field, memory.parent);
        this.memory = memory;
        this.port = port;
        this.field = field;
    }

    @Override
    public String absoluteName() {
        return this.memory.absoluteName() + ":" + this.name;
    }

    @Override
    public String dotId() {
        return this.memory.dotId() + ":" + this.name;
    }

    @Override
    public void render(IIndentStream stream) {
        // rendered by the memory
    }
}
