package org.hwviz.circuitVisualizer.errors;

import javax.annotation.Nullable;

/** Base class for exceptions which are thrown by the visualizer. */
public abstract class BaseVisualizerException extends RuntimeException {
    protected BaseVisualizerException(String message, @Nullable Throwable throwable) {
        super(message, throwable);
    }

    protected BaseVisualizerException(String message) {
        this(message, null);
    }

    public abstract String getErrorKind();
}
