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

import com.github.tinemuz.radiocarbon.CalibrationCurve.Column;
import com.github.tinemuz.radiocarbon.CalibrationException.ErrorKind;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calibrates a density over radiocarbon ages (an {@link UncalGrid}, such as a
 * back-calibrated date or a simulated distribution) into a density over calendar years.
 *
 * <p>The result covers {@code options.timeRange()}; densities below
 * {@code options.eps()} are zeroed, the grid is normalised when
 * {@code options.normalised()} is set and compacted when {@code options.compact()} is
 * set. The likelihood model of the options is not used: the {@link InversionStrategy#FULL}
 * strategy always calibrates in radiocarbon-age space.</p>
 */
public final class GridCalibrator {
    private static final Logger log = LoggerFactory.getLogger(GridCalibrator.class);

    private GridCalibrator() {}

    /**
     * Calibrate a radiocarbon-age density.
     *
     * @param grid           density over radiocarbon ages
     * @param errors         measurement error per grid age, or one shared error; only
     *                       used by {@link InversionStrategy#FULL}
     * @param curve          calibration curve
     * @param strategy       {@link InversionStrategy#FULL} or {@link InversionStrategy#FAST}
     * @param options        window, eps, normalisation of the result and compaction
     * @param dateNormalised normalise each age's calibration before weighting (FULL only)
     * @throws CalibrationException {@link ErrorKind#INPUT_LENGTH_MISMATCH} for mismatched
     *     errors, {@link ErrorKind#CURVE_RANGE_EXCEEDED} for grid ages outside the curve,
     *     {@link ErrorKind#DATE_OUT_OF_CALIBRATION_RANGE} if the window reaches past the
     *     curve
     */
    public static CalGrid calibrate(
            UncalGrid grid,
            double[] errors,
            CalibrationCurve curve,
            InversionStrategy strategy,
            CalibrationOptions options,
            boolean dateNormalised) {
        int[] calBP = curve.calendarGrid();
        double[] dens;
        switch (strategy) {
            case FULL:
                dens = full(grid, errors, curve, calBP, options.eps(), dateNormalised);
                break;
            case FAST:
                if (dateNormalised) {
                    log.warn("Cannot normalise dates using the fast method; leaving them unnormalised");
                }
                dens = fast(grid, curve, calBP);
                break;
            default:
                throw new CalibrationException(
                        ErrorKind.UNSUPPORTED_INVERSION_MODE, "Unsupported strategy " + strategy);
        }
        CalGrid windowed =
                ForwardCalibrator.window(
                        calBP, dens, options.timeRange(), false, "Radiocarbon-age grid", curve);
        double[] out = windowed.density();
        ForwardCalibrator.floor(out, options.eps());
        if (options.normalised()) {
            double sum = 0.0;
            for (double d : out) sum += d;
            if (sum > 0) {
                for (int i = 0; i < out.length; i++) out[i] /= sum;
            }
        }
        CalGrid result = new CalGrid(windowed.calBP(), out);
        return options.compact() ? result.compact() : result;
    }

    /** {@link #calibrate} with zero measurement error and no per-date normalisation. */
    public static CalGrid calibrate(
            UncalGrid grid,
            CalibrationCurve curve,
            InversionStrategy strategy,
            CalibrationOptions options) {
        return calibrate(grid, new double[] {0.0}, curve, strategy, options, false);
    }

    private static double[] full(
            UncalGrid grid,
            double[] errors,
            CalibrationCurve curve,
            int[] calBP,
            double eps,
            boolean dateNormalised) {
        int n = grid.size();
        if (errors.length != 1 && errors.length != n) {
            throw new CalibrationException(
                    ErrorKind.INPUT_LENGTH_MISMATCH,
                    "Got " + errors.length + " errors for " + n + " radiocarbon ages");
        }
        for (int i = 0; i < n; i++) curve.requireRadiocarbonAge(grid.ageAt(i));
        double[] sum = new double[calBP.length];
        if (calBP.length == 0) return sum;
        CalibrationOptions each =
                CalibrationOptions.builder()
                        .timeRange(calBP[0], calBP[calBP.length - 1])
                        .normalised(dateNormalised)
                        .eps(eps)
                        .compact(false)
                        .build();
        for (int i = 0; i < n; i++) {
            double weight = grid.densityAt(i);
            if (weight == 0.0) continue;
            double err = errors.length == 1 ? errors[0] : errors[i];
            CalGrid g = ForwardCalibrator.calibrate(grid.ageAt(i), err, curve, each);
            for (int j = 0; j < calBP.length; j++) sum[j] += g.densityAt(j) * weight;
        }
        return sum;
    }

    private static double[] fast(UncalGrid grid, CalibrationCurve curve, int[] calBP) {
        double[] cra = curve.interpolate(calBP, Column.RADIOCARBON_AGE);
        double[] dens = new double[calBP.length];
        for (int j = 0; j < calBP.length; j++) {
            dens[j] = grid.densityAtAge((int) Math.rint(cra[j]));
        }
        return dens;
    }
}
