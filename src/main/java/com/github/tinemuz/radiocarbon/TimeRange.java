/*
 * MIT License
 *
 * Copyright (c) 2025 tinemuz
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

package com.github.tinemuz.radiocarbon;

/**
 * Inclusive calendar window in years BP. {@code startBP} is the older bound.
 *
 * @param startBP earliest (oldest) year kept
 * @param endBP   latest (youngest) year kept
 */
public record TimeRange(int startBP, int endBP) {

    /** Window used when callers do not ask for one. */
    public static final TimeRange DEFAULT = new TimeRange(50000, 0);

    public TimeRange {
        if (startBP < endBP) {
            throw new IllegalArgumentException(
                    "startBP (" + startBP + ") must not be younger than endBP (" + endBP + ")");
        }
    }

    public boolean contains(int yearBP) {
        return yearBP <= startBP && yearBP >= endBP;
    }

    /** Number of integer years in the window. */
    public int years() {
        return startBP - endBP + 1;
    }
}
