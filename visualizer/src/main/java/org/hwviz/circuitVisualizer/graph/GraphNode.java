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

package org.hwviz.circuitVisualizer.graph;

import org.hwviz.util.ICastable;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.Utilities;

import javax.annotation.Nullable;
import java.util.regex.Pattern;

/** A node of the graph produced for a circuit.
 * Each node knows how to render itself as a Graphviz statement and
 * which reference other nodes should use when drawing an edge from it. */
public abstract class GraphNode implements ICastable {
    static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");

    public final String name;
    /** Container that holds this node; null only for the root module. */
    @Nullable
    public final ModuleNode parent;

    protected GraphNode(String name, @Nullable ModuleNode parent) {
        this.name = name;
        this.parent = parent;
    }

    /** Name qualified by the names of all enclosing modules.  Unique in a graph. */
    public String absoluteName() {
        String local = Utilities.flattenName(this.name);
        if (this.parent == null)
            return local;
        return this.parent.absoluteName() + "_" + local;
    }

    /** Identifier of this node in the Graphviz output. */
    public String dotId() {
        return quoteId(this.absoluteName());
    }

    /** Reference used when this node is the source of an edge. */
    public String asRhs() {
        return this.dotId();
    }

    /** A Graphviz identifier for a name; names that are not plain identifiers are quoted. */
    public static String quoteId(String name) {
        if (PLAIN_ID.matcher(name).matches())
            return name;
        return Utilities.doubleQuote(name);
    }

    /** Emit the Graphviz statement(s) describing this node. */
    public abstract void render(IIndentStream stream);

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " " + this.absoluteName();
    }
}
