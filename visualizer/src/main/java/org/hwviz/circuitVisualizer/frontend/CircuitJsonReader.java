package org.hwviz.circuitVisualizer.frontend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hwviz.circuitVisualizer.errors.BaseVisualizerException;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.circuitVisualizer.ir.Circuit;
import org.hwviz.circuitVisualizer.ir.IRNode;
import org.hwviz.circuitVisualizer.ir.expression.Expression;
import org.hwviz.circuitVisualizer.ir.expression.UnsupportedExpression;
import org.hwviz.circuitVisualizer.ir.statement.Statement;
import org.hwviz.circuitVisualizer.ir.statement.UnsupportedStatement;
import org.hwviz.util.IWritesLogs;
import org.hwviz.util.Logger;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/** Reads a circuit from its JSON representation.
 * Every object describing an IR node has a "class" property holding the
 * simple name of the IR class; the class provides a static method
 * {@code fromJson(JsonNode, CircuitJsonReader)} that builds the node. */
public class CircuitJsonReader implements IWritesLogs {
    static final String ROOT = "org.hwviz.circuitVisualizer.ir";
    static final List<String> PACKAGES = Arrays.asList("", "statement", "expression");

    final ObjectMapper mapper;

    public CircuitJsonReader() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    @Nullable
    static Class<?> getClass(String simpleName) {
        for (String pack: PACKAGES) {
            String className = ROOT;
            if (!pack.isEmpty())
                className += "." + pack;
            className += "." + simpleName;
            Class<?> result = Utilities.loadClass(className);
            if (result != null)
                return result;
        }
        return null;
    }

    static String getKind(JsonNode node) {
        if (!node.isObject())
            throw new CompilationError("Expected a JSON object, got " + node);
        JsonNode cls = node.get("class");
        if (cls == null)
            throw new CompilationError("Node does not have 'class' field: " + node);
        return cls.asText();
    }

    IRNode decode(JsonNode node, String kind, Class<?> clazz) {
        if (!IRNode.class.isAssignableFrom(clazz))
            throw new CompilationError(Utilities.singleQuote(kind) + " is not a circuit element");
        try {
            Method method = clazz.getMethod("fromJson", JsonNode.class, CircuitJsonReader.class);
            if (!Modifier.isStatic(method.getModifiers()))
                throw new RuntimeException(kind + ".fromJson is not static");
            IRNode result = (IRNode) method.invoke(null, node, this);
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("Decoded ")
                    .append(kind)
                    .newline();
            return result;
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof BaseVisualizerException)
                throw (BaseVisualizerException) e.getCause();
            throw new RuntimeException(e.getCause());
        } catch (NoSuchMethodException | IllegalAccessException e) {
            throw new CompilationError(Utilities.singleQuote(kind) + " cannot be read from JSON", e);
        }
    }

    /** Node standing for an element of unknown kind, or null if
     * no such element is acceptable where {@code expected} is. */
    @Nullable
    static IRNode unsupported(String kind, Class<? extends IRNode> expected) {
        if (expected == Statement.class)
            return new UnsupportedStatement(kind);
        if (expected == Expression.class)
            return new UnsupportedExpression(kind);
        return null;
    }

    /** Decode a JSON object into an IR node of the specified class.
     * Statements and expressions of unknown kinds are kept as opaque nodes,
     * since they only affect what is drawn for them. */
    public <T extends IRNode> T decode(JsonNode node, Class<T> clazz) {
        String kind = getKind(node);
        Class<?> actual = getClass(kind);
        IRNode result;
        if (actual != null) {
            result = this.decode(node, kind, actual);
        } else {
            result = unsupported(kind, clazz);
            if (result == null)
                throw new CompilationError("Unknown circuit element " + Utilities.singleQuote(kind));
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Unsupported ")
                    .append(clazz.getSimpleName())
                    .append(" ")
                    .append(kind)
                    .newline();
        }
        T cast = result.as(clazz);
        if (cast == null)
            throw new CompilationError("Expected " + clazz.getSimpleName() + ", got " +
                    result.getClass().getSimpleName() + ": " + node);
        return cast;
    }

    public Circuit read(String json) {
        try {
            JsonNode node = this.mapper.readTree(json);
            return this.decode(node, Circuit.class);
        } catch (JsonProcessingException e) {
            throw new CompilationError("Error parsing circuit JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Circuit read(Path file) throws IOException {
        return this.read(Utilities.readFile(file));
    }
}
