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
 * Metadata kept for one calibrated date: the measurement, the curve it was
 * calibrated against and the settings used.
 *
 * @param dateId               unique identifier
 * @param radiocarbonAge       measured radiocarbon age BP
 * @param error                measurement error
 * @param details              caller-supplied passthrough value, may be null
 * @param calCurve             curve name, or {@value CalibrationCurves#CUSTOM}
 * @param reservoirOffset      reservoir offset subtracted before calibration
 * @param reservoirOffsetError error of the reservoir offset
 * @param startBP              oldest year of the requested window
 * @param endBP                youngest year of the requested window
 * @param normalised           whether densities were normalised
 * @param f14c                 whether the F14C likelihood was used
 * @param eps                  density floor
 */
public record DateRecord(
        String dateId,
        double radiocarbonAge,
        double error,
        Object details,
        String calCurve,
        double reservoirOffset,
        double reservoirOffsetError,
        int startBP,
        int endBP,
        boolean normalised,
        boolean f14c,
        double eps) {}
