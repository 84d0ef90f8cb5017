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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.circuitVisualizer.errors.InternalCompilerError;
import org.jetbrains.annotations.Contract;

import javax.annotation.Nullable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Static helpers shared by all the packages. */
public class Utilities {
    private Utilities() {}

    /* ---------------- invariants */

    static String stackTrace() {
        StringBuilder builder = new StringBuilder();
        // Skip getStackTrace, stackTrace and enforce
        StackTraceElement[] frames = Thread.currentThread().getStackTrace();
        for (int i = 3; i < frames.length; i++)
            builder.append(frames[i]).append(System.lineSeparator());
        return builder.toString();
    }

    /** Check an internal invariant; unlike assert this is never compiled out.
     * @throws InternalCompilerError when the condition is false. */
    @Contract("false -> fail")
    public static void enforce(boolean condition) {
        enforce(condition, "Assertion failed");
    }

    @Contract("false, _ -> fail")
    public static void enforce(boolean condition, String message) {
        if (!condition)
            throw new InternalCompilerError(message + System.lineSeparator() + stackTrace());
    }

    /* ---------------- strings */

    /** Backslash-escape quotes, backslashes and control characters. */
    public static String escape(String value) {
        StringBuilder builder = new StringBuilder(value.length());
        value.codePoints().forEach(c -> {
            switch (c) {
                case '\\': builder.append("\\\\"); break;
                case '"': builder.append("\\\""); break;
                case '\r': builder.append("\\r"); break;
                case '\n': builder.append("\\n"); break;
                case '\t': builder.append("\\t"); break;
                default: builder.appendCodePoint(c); break;
            }
        });
        return builder.toString();
    }

    /** The value escaped and surrounded by double quotes, as in a DOT attribute. */
    public static String doubleQuote(String value) {
        return '"' + escape(value) + '"';
    }

    /** Surround with single quotes; used in messages, so nothing is escaped. */
    public static String singleQuote(@Nullable String value) {
        return "'" + value + "'";
    }

    /** Escape the characters that have a meaning in a Graphviz HTML-like label. */
    public static String escapeHtml(String value) {
        return value.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    /** Replace the characters that separate hierarchy levels in circuit names,
     * so the result is a legal Graphviz identifier. */
    public static String flattenName(String name) {
        return name.replace('.', '_')
                .replace('[', '_')
                .replace(']', '_');
    }

    /* ---------------- collections */

    /** Value for a key that is known to be present. */
    public static <K, V> V getExists(Map<K, V> map, K key) {
        V result = map.get(key);
        enforce(result != null, "Missing key " + singleQuote(String.valueOf(key)));
        return result;
    }

    public static <T> T last(List<T> data) {
        enforce(!data.isEmpty(), "Last element of an empty list");
        return data.get(data.size() - 1);
    }

    public static <T> T removeLast(List<T> data) {
        enforce(!data.isEmpty(), "Removing from an empty list");
        return data.remove(data.size() - 1);
    }

    /* ---------------- reflection and files */

    /** The class with this fully-qualified name, or null if it does not exist. */
    @Nullable
    public static Class<?> loadClass(String className) {
        try {
            return Class.forName(className);
        } catch (ClassNotFoundException ex) {
            return null;
        }
    }

    public static String readFile(Path file) throws IOException {
        return String.join(System.lineSeparator(), Files.readAllLines(file));
    }

    /* ---------------- json */

    /** A mapper with a stable property order that rejects duplicate keys. */
    public static ObjectMapper deterministicObjectMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true)
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(DeserializationFeature.FAIL_ON_READING_DUP_TREE_KEY, true)
                .build();
    }

    /** A property that must be present.
     * @throws CompilationError naming the property when it is missing. */
    public static JsonNode getProperty(JsonNode node, String property) {
        JsonNode result = node.get(property);
        if (result == null)
            throw new CompilationError("Missing property " + singleQuote(property) + " in " + node);
        return result;
    }

    public static String getStringProperty(JsonNode node, String property) {
        return getProperty(node, property).asText();
    }

    public static int getIntProperty(JsonNode node, String property) {
        return getProperty(node, property).asInt();
    }

    /** A property holding an array of strings; missing properties produce an empty list. */
    public static List<String> getStringListProperty(JsonNode node, String property) {
        List<String> result = new ArrayList<>();
        JsonNode array = node.get(property);
        if (array == null)
            return result;
        if (!array.isArray())
            throw new CompilationError("Property " + singleQuote(property) + " is not an array in " + node);
        array.forEach(e -> result.add(e.asText()));
        return result;
    }

    /* ---------------- external programs */

    /**
     * Run an external program and wait for it.
     * Its output is captured in a temporary file, since a child writing to
     * the console corrupts the surefire channel when running under tests;
     * the output is only shown when the program fails.
     * @param directory Working directory.
     * @param command   Program followed by its arguments.
     * @throws IOException if the program cannot be started or exits with an error.
     */
    public static void runProcess(String directory, String... command)
            throws IOException, InterruptedException {
        File output = File.createTempFile("process", ".out");
        output.deleteOnExit();
        Process process = new ProcessBuilder(command)
                .directory(new File(directory))
                .redirectOutput(output)
                .redirectError(output)
                .start();
        int exitCode = process.waitFor();
        if (exitCode != 0) {
            System.err.println(Files.readString(output.toPath()));
            throw new IOException(String.join(" ", Arrays.asList(command)) +
                    " failed with exit code " + exitCode);
        }
    }
}
