package org.hwviz.circuitVisualizer.visitors;

/** Result of a preorder visit: whether the children of a node should be visited. */
public enum VisitDecision {
    CONTINUE,
    STOP;

    public boolean stop() {
        return this == STOP;
    }
}
