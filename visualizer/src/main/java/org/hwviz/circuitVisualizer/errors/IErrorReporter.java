package org.hwviz.circuitVisualizer.errors;

/** Interface for reporting errors. */
public interface IErrorReporter {
    /** Report a problem (error or warning).
     *
     * @param location  Qualified name of the module instance where the problem occurred;
     *                  empty if the problem is not tied to a module.
     * @param warning   If true, this is a warning.
     * @param errorType Type of error.
     * @param message   Message to report.
     */
    void reportProblem(String location, boolean warning, String errorType, String message);

    default void reportError(String location, String errorType, String message) {
        this.reportProblem(location, false, errorType, message);
    }

    default void reportWarning(String location, String errorType, String message) {
        this.reportProblem(location, true, errorType, message);
    }

    /** True if any error (but not a warning) has been reported. */
    boolean hasErrors();
}
