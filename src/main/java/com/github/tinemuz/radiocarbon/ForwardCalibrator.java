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

/**
 * Calibrates a single radiocarbon measurement into a probability density over
 * calendar years.
 *
 * <p>The measurement is compared with the curve at every integer calendar year the
 * curve covers, either as a normal likelihood on radiocarbon age or as a Gaussian
 * likelihood on fraction modern carbon. Densities below {@code eps} are set to zero.
 * Normalisation happens over the whole curve before the result is cut down to the
 * requested window, so the returned grid sums to 1 only when the window holds all of
 * the mass.</p>
 *
 * <p>Stateless and safe to call from any number of threads.</p>
 */
public final class ForwardCalibrator {

    /** Mean life (years) used to convert radiocarbon age to fraction modern. */
    static final double F14C_MEAN_LIFE = 8033.0;

    private ForwardCalibrator() {}

    /**
     * Calibrate one measurement with no reservoir offset.
     *
     * @see #calibrate(double, double, CalibrationCurve, double, double, CalibrationOptions)
     */
    public static CalGrid calibrate(
            double age, double error, CalibrationCurve curve, CalibrationOptions options) {
        return calibrate(age, error, curve, 0.0, 0.0, options);
    }

    /**
     * Calibrate one measurement.
     *
     * <p>The reservoir offset is subtracted from the age and its error is added to the
     * measurement error (linearly, not in quadrature).</p>
     *
     * @param age                  radiocarbon age BP
     * @param error                one standard deviation of the age
     * @param curve                calibration curve
     * @param reservoirOffset      reservoir age offset, subtracted from {@code age}
     * @param reservoirOffsetError error of the offset, added to {@code error}
     * @param options              window, likelihood model, normalisation, eps, compaction
     * @return density per calendar year inside {@code options.timeRange()}
     * @throws CalibrationException {@link ErrorKind#MISSING_VALUE} for NaN inputs,
     *     {@link ErrorKind#CURVE_RANGE_EXCEEDED} if the offset age lies outside the curve's
     *     radiocarbon ages, {@link ErrorKind#DATE_OUT_OF_CALIBRATION_RANGE} if the window
     *     reaches past the curve or nothing survives the density floor
     */
    public static CalGrid calibrate(
            double age,
            double error,
            CalibrationCurve curve,
            double reservoirOffset,
            double reservoirOffsetError,
            CalibrationOptions options) {
        if (Double.isNaN(age) || Double.isNaN(error)
                || Double.isNaN(reservoirOffset) || Double.isNaN(reservoirOffsetError)) {
            throw new CalibrationException(ErrorKind.MISSING_VALUE, "Age or error is NaN");
        }
        double effectiveAge = age - reservoirOffset;
        double effectiveError = error + reservoirOffsetError;
        curve.requireRadiocarbonAge(effectiveAge);

        int[] calBP = curve.calendarGrid();
        double[] dens = options.useF14C()
                ? f14cLikelihood(effectiveAge, effectiveError, curve, calBP)
                : radiocarbonLikelihood(effectiveAge, effectiveError, curve, calBP);
        double eps = options.eps();
        floor(dens, eps);
        if (options.normalised()) {
            normalise(dens, age, curve);
            floor(dens, eps);
            normalise(dens, age, curve);
        }
        return window(
                calBP, dens, options.timeRange(), options.compact(), "Radiocarbon age " + age, curve);
    }

    /** Densities at or above this value survive; everything below becomes zero. */
    static void floor(double[] dens, double eps) {
        for (int i = 0; i < dens.length; i++) {
            if (dens[i] < eps) dens[i] = 0.0;
        }
    }

    /**
     * Cut a full curve grid down to the window.
     *
     * @param what names the calibrated quantity in the error message
     */
    static CalGrid window(
            int[] calBP,
            double[] dens,
            TimeRange range,
            boolean compact,
            String what,
            CalibrationCurve curve) {
        int n = range.years();
        int[] years = new int[n];
        double[] out = new double[n];
        int first = calBP.length == 0 ? 0 : calBP[0];
        for (int i = 0; i < n; i++) {
            int y = range.startBP() - i;
            int idx = first - y;
            double d = idx >= 0 && idx < calBP.length ? dens[idx] : Double.NaN;
            if (Double.isNaN(d)) {
                throw new CalibrationException(
                        ErrorKind.DATE_OUT_OF_CALIBRATION_RANGE,
                        what + " cannot be calibrated over " + range.startBP()
                                + ".." + range.endBP() + " BP: curve '" + curve.name()
                                + "' does not cover year " + y);
            }
            years[i] = y;
            out[i] = d;
        }
        CalGrid grid = new CalGrid(years, out);
        return compact ? grid.compact() : grid;
    }

    private static double[] radiocarbonLikelihood(
            double age, double error, CalibrationCurve curve, int[] calBP) {
        double[] mu = curve.interpolate(calBP, Column.RADIOCARBON_AGE);
        double[] curveError = curve.interpolate(calBP, Column.ERROR);
        double[] dens = new double[calBP.length];
        double err2 = error * error;
        for (int i = 0; i < calBP.length; i++) {
            double tau = err2 + curveError[i] * curveError[i];
            dens[i] = Gaussian.density(age, mu[i], Math.sqrt(tau));
        }
        return dens;
    }

    private static double[] f14cLikelihood(
            double age, double error, CalibrationCurve curve, int[] calBP) {
        CalibrationCurve f14 = curve.inF14C();
        double[] calF14 = f14.interpolate(calBP, Column.RADIOCARBON_AGE);
        double[] calF14Error = f14.interpolate(calBP, Column.ERROR);

        double sampleF14 = toF14C(age);
        double sampleError = sampleF14 * error / F14C_MEAN_LIFE;
        double[] dens = new double[calBP.length];
        for (int i = 0; i < calBP.length; i++) {
            double diff = sampleF14 - calF14[i];
            double var = sampleError * sampleError + calF14Error[i] * calF14Error[i];
            dens[i] = var == 0.0
                    ? (diff == 0.0 ? 1.0 : 0.0)
                    : Math.exp(-diff * diff / (2.0 * var)) / Math.sqrt(var);
        }
        return dens;
    }

    static double toF14C(double radiocarbonAge) {
        return Math.exp(radiocarbonAge / -F14C_MEAN_LIFE);
    }

    private static void normalise(double[] dens, double age, CalibrationCurve curve) {
        double sum = 0.0;
        for (double d : dens) {
            if (!Double.isNaN(d)) sum += d;
        }
        if (!(sum > 0)) {
            throw new CalibrationException(
                    ErrorKind.DATE_OUT_OF_CALIBRATION_RANGE,
                    "Radiocarbon age " + age + " has no density above eps on curve '"
                            + curve.name() + "'");
        }
        for (int i = 0; i < dens.length; i++) dens[i] /= sum;
    }
}
