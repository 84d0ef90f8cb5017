/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.hwviz.util;

import org.hwviz.circuitVisualizer.errors.CompilationError;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-class debug logging.  Every class starts at level 0 (silent); a class
 * logs a message only when its level is at least the level of the message.
 * Output goes to a single shared {@link IndentStream}, so nested structures
 * keep their indentation in the log.
 */
public class Logger {
    /** Classes that can be named on the command line, e.g. -TCircuitVisualizer=2,
     * are looked up in these packages. */
    static final List<String> LOGGING_PACKAGES = List.of(
            "org.hwviz.circuitVisualizer",
            "org.hwviz.circuitVisualizer.compiler",
            "org.hwviz.circuitVisualizer.backend",
            "org.hwviz.circuitVisualizer.frontend");

    public static final Logger INSTANCE = new Logger();

    private final Map<Class<?>, Integer> levels = new LinkedHashMap<>();
    private final IndentStream debugStream = new IndentStream(System.err);
    private final IIndentStream discard = new NullIndentStream();

    private Logger() {}

    /** Stream for a message of the given level logged by a class.
     * Messages above the class level are discarded. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.getLoggingLevel(clazz) >= level ? this.debugStream : this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs writer, int level) {
        return this.belowLevel(writer.getClass(), level);
    }

    /** Change the level of a class; subclasses inherit it.
     * @return The level the class had before. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Change the level of a class given by its simple name.
     * @return The level the class had before. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String simpleName, int level) {
        return this.setLoggingLevel(this.locateClass(simpleName), level);
    }

    Class<?> locateClass(String simpleName) {
        for (String pack: LOGGING_PACKAGES) {
            Class<?> result = Utilities.loadClass(pack + "." + simpleName);
            if (result != null)
                return result;
        }
        throw new CompilationError("Cannot enable logging for unknown class " + Utilities.singleQuote(simpleName));
    }

    public int getLoggingLevel(Class<?> clazz) {
        for (Map.Entry<Class<?>, Integer> entry: this.levels.entrySet()) {
            if (entry.getKey().isAssignableFrom(clazz))
                return entry.getValue();
        }
        return 0;
    }

    /** Redirect the log; returns the previous destination.
     * The current indentation level is kept. */
    public Appendable setDebugStream(Appendable destination) {
        return this.debugStream.setOutputStream(destination);
    }
}
