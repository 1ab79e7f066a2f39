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
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Back-calibration: from calendar age to radiocarbon age.
 *
 * <p>The point form reads the curve at a calendar age and draws a plausible measured
 * age around it. The grid form turns a whole calendar density into a density over
 * integer radiocarbon ages: every calendar year contributes a normal density centred
 * on the curve's radiocarbon age for that year, weighted by its probability, and the
 * result is divided by the unweighted sum of the same densities.</p>
 *
 * <p>Random draws use the {@link Random} passed in, so results are reproducible with a
 * seeded generator.</p>
 */
public final class Uncalibrator {

    // exp(-z^2 / 2) underflows to zero beyond this many standard deviations
    private static final double UNDERFLOW_SIGMAS = 38.6;

    private Uncalibrator() {}

    /**
     * Result of uncalibrating one calendar age.
     *
     * @param calBP   calendar age BP that was looked up
     * @param ccCRA   curve radiocarbon age at {@code calBP}
     * @param ccError curve error at {@code calBP}
     * @param rCRA    random radiocarbon age drawn around {@code ccCRA}
     * @param rError  measurement error used for the draw
     */
    public record UncalibratedAge(
            double calBP, double ccCRA, double ccError, double rCRA, double rError) {}

    /**
     * Uncalibrate one calendar age.
     *
     * <p>The random age is drawn from a normal distribution with mean {@code ccCRA} and
     * standard deviation sqrt(ccError^2 + measurementError^2).</p>
     *
     * @param roundToInteger round the random age to a whole year
     * @throws CalibrationException {@link ErrorKind#MISSING_VALUE} for NaN input,
     *     {@link ErrorKind#CURVE_RANGE_EXCEEDED} outside the curve
     */
    public static UncalibratedAge uncalibrate(
            double calBP,
            double measurementError,
            CalibrationCurve curve,
            boolean roundToInteger,
            Random random) {
        if (Double.isNaN(calBP) || Double.isNaN(measurementError)) {
            throw new CalibrationException(
                    ErrorKind.MISSING_VALUE, "Calendar age or error is NaN");
        }
        double ccCRA = curve.lookup(calBP, Column.RADIOCARBON_AGE);
        double ccError = curve.lookup(calBP, Column.ERROR);
        double sd = Math.sqrt(ccError * ccError + measurementError * measurementError);
        double rCRA = ccCRA + sd * random.nextGaussian();
        if (roundToInteger) rCRA = Math.rint(rCRA);
        return new UncalibratedAge(calBP, ccCRA, ccError, rCRA, measurementError);
    }

    /**
     * Uncalibrate several calendar ages.
     *
     * @param measurementErrors one error for all ages, or one per age
     * @throws CalibrationException {@link ErrorKind#INPUT_LENGTH_MISMATCH} if the errors
     *     do not match the ages, {@link ErrorKind#CURVE_RANGE_EXCEEDED} if any age lies
     *     outside the curve (checked before any draw)
     */
    public static List<UncalibratedAge> uncalibrate(
            double[] calBP,
            double[] measurementErrors,
            CalibrationCurve curve,
            boolean roundToInteger,
            Random random) {
        if (measurementErrors.length != 1 && measurementErrors.length != calBP.length) {
            throw new CalibrationException(
                    ErrorKind.INPUT_LENGTH_MISMATCH,
                    "Got " + measurementErrors.length + " errors for " + calBP.length + " ages");
        }
        for (double c : calBP) curve.requireCalendarAge(c);
        List<UncalibratedAge> out = new ArrayList<>(calBP.length);
        for (int i = 0; i < calBP.length; i++) {
            double err = measurementErrors.length == 1 ? measurementErrors[0] : measurementErrors[i];
            out.add(uncalibrate(calBP[i], err, curve, roundToInteger, random));
        }
        return out;
    }

    /**
     * Uncalibrate a calendar density.
     *
     * <p>For each integer radiocarbon age k between the curve's largest and smallest
     * radiocarbon ages: Raw(k) is the sum over calendar years y of
     * p(y) * N(k; mu(y), sigma(y)) and Base(k) the same sum without p(y), where mu and
     * sigma are the curve's radiocarbon age and error at y. Raw is normalised and
     * floored at {@code eps}; the density is Raw/Base where Base is positive, then
     * normalised again.</p>
     *
     * @param compact drop ages with zero density
     * @throws CalibrationException {@link ErrorKind#CURVE_RANGE_EXCEEDED} if the grid has
     *     years outside the curve
     * @throws IllegalArgumentException if the grid is empty or has no mass
     */
    public static UncalGrid uncalibrate(
            CalGrid grid, CalibrationCurve curve, double eps, boolean compact) {
        if (grid.isEmpty()) throw new IllegalArgumentException("Cannot uncalibrate an empty grid");
        double total = grid.sum();
        if (!(total > 0)) throw new IllegalArgumentException("Grid has no probability mass");
        int years = grid.size();
        double[] mu = new double[years];
        double[] s = new double[years];
        double[] h = new double[years];
        for (int i = 0; i < years; i++) {
            int y = grid.yearAt(i);
            mu[i] = curve.lookup(y, Column.RADIOCARBON_AGE);
            s[i] = curve.lookup(y, Column.ERROR);
            h[i] = grid.densityAt(i) / total;
        }

        int kMax = (int) Math.floor(curve.maxRadiocarbonAge());
        int kMin = (int) Math.ceil(curve.minRadiocarbonAge());
        int n = Math.max(0, kMax - kMin + 1);
        double[] raw = new double[n];
        double[] base = new double[n];
        for (int i = 0; i < years; i++) {
            // only ages where the density does not underflow can contribute
            double reach = s[i] * UNDERFLOW_SIGMAS;
            int from = (int) Math.max(kMin, Math.floor(mu[i] - reach));
            int to = (int) Math.min(kMax, Math.ceil(mu[i] + reach));
            for (int k = from; k <= to; k++) {
                double d = Gaussian.density(k, mu[i], s[i]);
                int idx = kMax - k;
                base[idx] += d;
                raw[idx] += d * h[i];
            }
        }

        double rawSum = 0.0;
        for (double r : raw) rawSum += r;
        double[] dens = new double[n];
        if (rawSum > 0) {
            for (int j = 0; j < n; j++) {
                raw[j] /= rawSum;
                if (raw[j] < eps) raw[j] = 0.0;
                if (base[j] > 0) dens[j] = raw[j] / base[j];
            }
        }
        double densSum = 0.0;
        for (double d : dens) densSum += d;
        if (densSum > 0) {
            for (int j = 0; j < n; j++) dens[j] /= densSum;
        }

        int[] ages = new int[n];
        for (int j = 0; j < n; j++) ages[j] = kMax - j;
        if (!compact) return new UncalGrid(ages, dens, raw, base);
        int kept = 0;
        for (double d : dens) if (d > 0) kept++;
        int[] cAges = new int[kept];
        double[] cDens = new double[kept];
        double[] cRaw = new double[kept];
        double[] cBase = new double[kept];
        int j = 0;
        for (int i = 0; i < n; i++) {
            if (dens[i] > 0) {
                cAges[j] = ages[i];
                cDens[j] = dens[i];
                cRaw[j] = raw[i];
                cBase[j++] = base[i];
            }
        }
        return new UncalGrid(cAges, cDens, cRaw, cBase);
    }
}
