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

/** Synthetic curves shared by the tests. */
final class TestCurves {

    private TestCurves() {}

    /** Radiocarbon age equals calendar age on 3000..5000 BP, constant error. */
    static CalibrationCurve identity(double error) {
        return identity(3000, 5000, error);
    }

    static CalibrationCurve identity(int fromBP, int toBP, double error) {
        double[][] table = new double[toBP - fromBP + 1][];
        for (int y = fromBP; y <= toBP; y++) {
            table[y - fromBP] = new double[] {y, y, error};
        }
        return CalibrationCurve.of(CalibrationCurves.CUSTOM, table);
    }

    /** Options limited to a window inside {@link #identity(double)}. */
    static CalibrationOptions window(int startBP, int endBP) {
        return CalibrationOptions.builder().timeRange(startBP, endBP).build();
    }

    static double sum(double[] values) {
        double s = 0.0;
        for (double v : values) s += v;
        return s;
    }
}
