package org.hwviz.circuitVisualizer.ir;

import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.util.Utilities;

/** Direction of a module port. */
public enum Direction {
    INPUT("input"),
    OUTPUT("output");

    public final String text;

    Direction(String text) {
        this.text = text;
    }

    public static Direction fromString(String text) {
        for (Direction d: Direction.values())
            if (d.text.equals(text))
                return d;
        throw new CompilationError("Unknown port direction " + Utilities.singleQuote(text));
    }

    @Override
    public String toString() {
        return this.text;
    }
}
