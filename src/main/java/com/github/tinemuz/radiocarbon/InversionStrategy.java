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

import com.github.tinemuz.radiocarbon.CalibrationException.ErrorKind;
import java.util.Locale;

/** How {@link GridCalibrator} maps a radiocarbon-age density onto calendar years. */
public enum InversionStrategy {
    /** Calibrate every radiocarbon age of the grid and sum the weighted results. */
    FULL,
    /** Read the density at the curve's rounded radiocarbon age for each calendar year. */
    FAST;

    /**
     * Case-insensitive lookup by name.
     *
     * @throws CalibrationException with {@link ErrorKind#UNSUPPORTED_INVERSION_MODE} for
     *     any other name
     */
    public static InversionStrategy parse(String name) {
        if (name != null) {
            for (InversionStrategy s : values()) {
                if (s.name().equals(name.trim().toUpperCase(Locale.ROOT))) return s;
            }
        }
        throw new CalibrationException(
                ErrorKind.UNSUPPORTED_INVERSION_MODE,
                "Type must be 'full' or 'fast', got '" + name + "'");
    }
}
