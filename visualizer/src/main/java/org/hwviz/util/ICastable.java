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

import org.hwviz.circuitVisualizer.errors.InternalCompilerError;

import javax.annotation.Nullable;

/** Checked downcasts for the IR and graph class hierarchies. */
public interface ICastable {
    /** This object as a {@code T}, or null if it is not one. */
    @Nullable
    default <T> T as(Class<T> clazz) {
        return clazz.isInstance(this) ? clazz.cast(this) : null;
    }

    /** This object as a {@code T}.
     * @throws InternalCompilerError if it is not one. */
    default <T> T to(Class<T> clazz) {
        if (!clazz.isInstance(this))
            throw new InternalCompilerError("Expected " + clazz.getSimpleName() + ", found " +
                    this.getClass().getSimpleName() + ": " + this);
        return clazz.cast(this);
    }

    default boolean is(Class<?> clazz) {
        return clazz.isInstance(this);
    }
}
