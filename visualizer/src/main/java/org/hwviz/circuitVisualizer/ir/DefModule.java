package org.hwviz.circuitVisualizer.ir;

import org.hwviz.util.Linq;

import java.util.List;

/** A module definition: either a {@link CircuitModule} with a body
 * or an {@link ExtModule} whose implementation is opaque. */
public abstract class DefModule extends IRNode {
    public final String name;
    public final List<Port> ports;

    protected DefModule(String name, List<Port> ports) {
        this.name = name;
        this.ports = ports;
    }

    /** Ports with the specified direction, in declaration order. */
    public List<Port> getPorts(Direction direction) {
        return Linq.where(this.ports, p -> p.direction == direction);
    }
}
