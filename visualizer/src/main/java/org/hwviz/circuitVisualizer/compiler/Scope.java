package org.hwviz.circuitVisualizer.compiler;

/** How much of a module instance is drawn.
 * {@code elapsedDepth} counts the instance levels descended since the
 * scope was last reset by an annotation; {@code maxDepth} is the limit,
 * negative meaning unlimited. */
public final class Scope {
    public static final Scope DEFAULT = new Scope(0, -1);

    public final int elapsedDepth;
    public final int maxDepth;

    public Scope(int elapsedDepth, int maxDepth) {
        this.elapsedDepth = elapsedDepth;
        this.maxDepth = maxDepth;
    }

    public boolean isUnlimited() {
        return this.maxDepth < 0;
    }

    /** True if the ports of the module should be drawn. */
    public boolean doPorts() {
        return this.isUnlimited() || this.elapsedDepth <= this.maxDepth;
    }

    /** True if the contents of the module (beyond its ports) should be drawn. */
    public boolean doComponents() {
        return this.isUnlimited() || this.elapsedDepth < this.maxDepth;
    }

    /** Scope for an instance nested one level deeper. */
    public Scope descend() {
        return new Scope(this.elapsedDepth + 1, this.maxDepth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scope scope = (Scope) o;
        return this.elapsedDepth == scope.elapsedDepth && this.maxDepth == scope.maxDepth;
    }

    @Override
    public int hashCode() {
        return 31 * this.elapsedDepth + this.maxDepth;
    }

    @Override
    public String toString() {
        return "Scope(" + this.elapsedDepth + ", " + this.maxDepth + ")";
    }
}
