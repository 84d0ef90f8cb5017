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

package org.hwviz.circuitVisualizer.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwviz.circuitVisualizer.errors.CompilationError;
import org.hwviz.circuitVisualizer.frontend.CircuitJsonReader;
import org.hwviz.circuitVisualizer.visitors.IRVisitor;
import org.hwviz.util.ICastable;
import org.hwviz.util.IHasId;
import org.hwviz.util.IndentStreamBuilder;
import org.hwviz.util.Linq;
import org.hwviz.util.ToIndentableString;
import org.hwviz.util.Utilities;

import java.util.List;

/** Base class for all circuit IR nodes.
 * IR nodes are immutable; the visualizer only observes them. */
public abstract class IRNode implements ICastable, IHasId, ToIndentableString {
    static long crtId = 0;
    public final long id;

    protected IRNode() {
        this.id = crtId++;
    }

    @Override
    public long getId() {
        return this.id;
    }

    public abstract void accept(IRVisitor visitor);

    @Override
    public String toString() {
        IndentStreamBuilder stream = new IndentStreamBuilder();
        this.toString(stream);
        return stream.toString();
    }

    public static <T extends IRNode> T fromJsonNode(
            JsonNode node, String property, CircuitJsonReader reader, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return reader.decode(prop, clazz);
    }

    public static <T extends IRNode> List<T> fromJsonList(
            JsonNode node, CircuitJsonReader reader, Class<T> clazz) {
        if (!node.isArray())
            throw new CompilationError("Node is not an array: " + node);
        return Linq.map(node.elements(), e -> reader.decode(e, clazz));
    }

    public static <T extends IRNode> List<T> fromJsonList(
            JsonNode node, String property, CircuitJsonReader reader, Class<T> clazz) {
        JsonNode prop = Utilities.getProperty(node, property);
        return fromJsonList(prop, reader, clazz);
    }
}
