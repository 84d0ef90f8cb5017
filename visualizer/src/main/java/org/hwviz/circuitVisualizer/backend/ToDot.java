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

package org.hwviz.circuitVisualizer.backend;

import org.hwviz.circuitVisualizer.annotation.VisualizerAnnotation;
import org.hwviz.circuitVisualizer.graph.ModuleNode;
import org.hwviz.util.IIndentStream;
import org.hwviz.util.IWritesLogs;
import org.hwviz.util.IndentStream;
import org.hwviz.util.IndentStreamBuilder;
import org.hwviz.util.Logger;
import org.hwviz.util.Utilities;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;

/** Writes the graph of a circuit as a Graphviz file, and optionally
 * draws and displays it with external programs. */
public class ToDot implements IWritesLogs {
    final String main;
    final ModuleNode root;

    /** @param main  Name of the circuit top module; names the graph and the file.
     *  @param root  Container produced for the top module. */
    public ToDot(String main, ModuleNode root) {
        this.main = main;
        this.root = root;
    }

    public void render(IIndentStream stream) {
        stream.append("digraph ")
                .append(this.main)
                .append(" {")
                .increase();
        this.root.render(stream);
        stream.decrease()
                .append("}")
                .newline();
    }

    /** The whole Graphviz document as a string. */
    public String render() {
        IndentStreamBuilder builder = new IndentStreamBuilder();
        this.render(builder);
        return builder.toString();
    }

    public String getFileName() {
        return this.main + ".dot";
    }

    /** Write the Graphviz document to the specified directory.
     * @return The file written. */
    public File write(String directory) throws IOException {
        File file = Path.of(directory, this.getFileName()).toFile();
        try (PrintWriter writer = new PrintWriter(file, "UTF-8")) {
            IndentStream stream = new IndentStream(writer);
            this.render(stream);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Wrote ")
                .append(file.getPath())
                .newline();
        return file;
    }

    /** Convert a dot file to png with {@code dotProgram}, then show the png with
     * {@code openProgram}.  A program named "none" skips its step; skipping
     * the conversion also skips the display. */
    public static void show(File file, String dotProgram, String openProgram)
            throws IOException, InterruptedException {
        if (dotProgram.equals(VisualizerAnnotation.NONE))
            return;
        String directory = file.getAbsoluteFile().getParent();
        Utilities.runProcess(directory, dotProgram, "-Tpng", "-O", file.getName());
        if (openProgram.equals(VisualizerAnnotation.NONE))
            return;
        Utilities.runProcess(directory, openProgram, file.getName() + ".png");
    }
}
