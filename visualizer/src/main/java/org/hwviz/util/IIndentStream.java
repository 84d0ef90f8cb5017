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

import java.util.Collection;
import java.util.function.Supplier;

/** A character sink that indents every line by the current nesting level.
 * Used for IR pretty-printing, Graphviz output, and logging. */
@SuppressWarnings("UnusedReturnValue")
public interface IIndentStream {
    IIndentStream appendChar(char c);

    /** Append a string that does not contain a newline */
    IIndentStream appendFast(String string);

    /** Increase indentation and emit a newline. */
    IIndentStream increase();

    IIndentStream decrease();

    default IIndentStream newline() {
        return this.appendChar('\n');
    }

    /** Append a string; each newline it contains starts an indented line. */
    default IIndentStream append(String string) {
        int start = 0;
        int end;
        while ((end = string.indexOf('\n', start)) >= 0) {
            this.appendFast(string.substring(start, end));
            this.newline();
            start = end + 1;
        }
        return this.appendFast(string.substring(start));
    }

    default <T extends ToIndentableString> IIndentStream append(T value) {
        value.toString(this);
        return this;
    }

    default IIndentStream append(long value) {
        return this.appendFast(Long.toString(value));
    }

    /** Append a double-quoted string, escaping the quotes it contains.
     * This is the form of Graphviz identifiers and labels. */
    default IIndentStream appendQuoted(String value) {
        return this.appendFast(Utilities.doubleQuote(value));
    }

    /** For lazy evaluation of the argument. */
    default IIndentStream appendSupplier(Supplier<String> supplier) {
        return this.append(supplier.get());
    }

    default IIndentStream join(String separator, Collection<String> data) {
        boolean first = true;
        for (String d: data) {
            if (!first)
                this.append(separator);
            first = false;
            this.append(d);
        }
        return this;
    }

    /** Append the elements separated by {@code separator}. */
    default <T extends ToIndentableString> IIndentStream joinI(String separator, Collection<T> data) {
        return this.separated(separator, data, false);
    }

    /** Append each element followed by {@code separator}. */
    default <T extends ToIndentableString> IIndentStream intercalateI(String separator, Collection<T> data) {
        return this.separated(separator, data, true);
    }

    private <T extends ToIndentableString> IIndentStream separated(
            String separator, Collection<T> data, boolean trailing) {
        boolean first = true;
        for (T d: data) {
            if (!first)
                this.append(separator);
            first = false;
            this.append(d);
        }
        if (trailing && !data.isEmpty())
            this.append(separator);
        return this;
    }
}
