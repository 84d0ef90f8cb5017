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

import java.io.IOException;
import java.io.UncheckedIOException;

/** An {@link IIndentStream} writing to an {@link Appendable}.
 * Indentation is emitted lazily, before the first non-space character of each line,
 * so blank lines carry no trailing spaces. */
public class IndentStream implements IIndentStream {
    private Appendable stream;
    /** Spaces per nesting level; 0 suppresses newlines entirely. */
    int amount;
    int level;
    boolean atLineStart;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
        this.amount = 4;
        this.level = 0;
        this.atLineStart = false;
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    public IndentStream setIndentAmount(int amount) {
        Utilities.enforce(amount >= 0);
        this.amount = amount;
        return this;
    }

    void write(CharSequence data) {
        try {
            this.stream.append(data);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    void indentIfNeeded() {
        if (this.atLineStart) {
            this.atLineStart = false;
            this.write(" ".repeat(this.level * this.amount));
        }
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            if (this.amount > 0) {
                this.write("\n");
                this.atLineStart = true;
            }
            return this;
        }
        if (!Character.isSpaceChar(c))
            this.indentIfNeeded();
        this.write(String.valueOf(c));
        return this;
    }

    @Override
    public IIndentStream appendFast(String string) {
        if (string.isEmpty())
            return this;
        this.indentIfNeeded();
        this.write(string);
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.level++;
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        if (this.level == 0)
            throw new IllegalStateException("Negative indent");
        this.level--;
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
