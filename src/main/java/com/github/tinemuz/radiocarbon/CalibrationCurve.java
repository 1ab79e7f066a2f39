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
import java.util.Arrays;
import java.util.Comparator;

/**
 * Immutable calibration curve: calendar age BP, radiocarbon age BP and curve error BP.
 *
 * <p>Rows are held sorted by calendar age. Lookups interpolate linearly between the
 * two neighbouring rows and never extrapolate; asking for a calendar age outside the
 * curve either fails ({@link #lookup}) or yields NaN ({@link #interpolate}), which
 * callers use to detect windows the curve does not cover.</p>
 *
 * <p>Instances are safe to share between threads.</p>
 */
public final class CalibrationCurve {

    /** Value columns that can be interpolated against calendar age. */
    public enum Column {
        RADIOCARBON_AGE,
        ERROR
    }

    private final String name;
    // ascending by calendar age; accessors hand out descending copies
    private final double[] calBP;
    private final double[] c14BP;
    private final double[] errorBP;
    private final double minC14;
    private final double maxC14;
    private volatile CalibrationCurve f14c;

    private CalibrationCurve(String name, double[] calBP, double[] c14BP, double[] errorBP) {
        this.name = name;
        this.calBP = calBP;
        this.c14BP = c14BP;
        this.errorBP = errorBP;
        double lo = Double.POSITIVE_INFINITY;
        double hi = Double.NEGATIVE_INFINITY;
        for (double v : c14BP) {
            lo = Math.min(lo, v);
            hi = Math.max(hi, v);
        }
        this.minC14 = lo;
        this.maxC14 = hi;
    }

    /**
     * Build a curve from a three-column table (calendar age BP, radiocarbon age BP,
     * curve error BP). Row order does not matter.
     *
     * @param name  label kept in date metadata, e.g. "custom"
     * @param table rows of exactly three finite numbers
     * @throws CalibrationException with {@link ErrorKind#INVALID_CURVE_FORMAT} if a row
     *     does not have three finite values, an error is negative, calendar ages repeat
     *     or fewer than two rows are given
     */
    public static CalibrationCurve of(String name, double[][] table) {
        if (table == null || table.length < 2) {
            throw new CalibrationException(
                    ErrorKind.INVALID_CURVE_FORMAT,
                    "A calibration curve needs at least two rows");
        }
        double[][] rows = new double[table.length][];
        for (int i = 0; i < table.length; i++) {
            double[] row = table[i];
            if (row == null || row.length != 3) {
                throw new CalibrationException(
                        ErrorKind.INVALID_CURVE_FORMAT,
                        "The custom calibration curve must have just three numeric columns (row "
                                + i + ")");
            }
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new CalibrationException(
                            ErrorKind.INVALID_CURVE_FORMAT,
                            "Non-numeric value in calibration curve row " + i);
                }
            }
            if (row[2] < 0) {
                throw new CalibrationException(
                        ErrorKind.INVALID_CURVE_FORMAT,
                        "Negative curve error in calibration curve row " + i);
            }
            rows[i] = row.clone();
        }
        Arrays.sort(rows, Comparator.comparingDouble(r -> r[0]));
        int n = rows.length;
        double[] cal = new double[n];
        double[] c14 = new double[n];
        double[] err = new double[n];
        for (int i = 0; i < n; i++) {
            if (i > 0 && rows[i][0] == rows[i - 1][0]) {
                throw new CalibrationException(
                        ErrorKind.INVALID_CURVE_FORMAT,
                        "Duplicate calendar age " + rows[i][0] + " in calibration curve");
            }
            cal[i] = rows[i][0];
            c14[i] = rows[i][1];
            err[i] = rows[i][2];
        }
        return new CalibrationCurve(name, cal, c14, err);
    }

    public String name() {
        return name;
    }

    public int size() {
        return calBP.length;
    }

    public double minCalendarAge() {
        return calBP[0];
    }

    public double maxCalendarAge() {
        return calBP[calBP.length - 1];
    }

    public double minRadiocarbonAge() {
        return minC14;
    }

    public double maxRadiocarbonAge() {
        return maxC14;
    }

    /** Calendar ages, oldest first. */
    public double[] calendarAges() {
        return reversed(calBP);
    }

    /** Radiocarbon ages in the same order as {@link #calendarAges()}. */
    public double[] radiocarbonAges() {
        return reversed(c14BP);
    }

    /** Curve errors in the same order as {@link #calendarAges()}. */
    public double[] errors() {
        return reversed(errorBP);
    }

    /** Rows as {calBP, c14BP, error}, oldest first. */
    public double[][] toTable() {
        int n = calBP.length;
        double[][] out = new double[n][];
        for (int i = 0; i < n; i++) {
            int j = n - 1 - i;
            out[i] = new double[] {calBP[j], c14BP[j], errorBP[j]};
        }
        return out;
    }

    /**
     * Every integer calendar year inside the curve, oldest first.
     */
    public int[] calendarGrid() {
        int hi = (int) Math.floor(maxCalendarAge());
        int lo = (int) Math.ceil(minCalendarAge());
        int[] years = new int[Math.max(0, hi - lo + 1)];
        for (int i = 0; i < years.length; i++) years[i] = hi - i;
        return years;
    }

    /**
     * Interpolate a column at a calendar age.
     *
     * @throws CalibrationException with {@link ErrorKind#CURVE_RANGE_EXCEEDED} when the
     *     age lies outside the curve
     */
    public double lookup(double calendarAgeBP, Column column) {
        requireCalendarAge(calendarAgeBP);
        return interpolate(calendarAgeBP, column);
    }

    /**
     * Interpolate a column at a calendar age, returning NaN outside the curve.
     */
    public double interpolate(double calendarAgeBP, Column column) {
        double[] ys = values(column);
        if (Double.isNaN(calendarAgeBP)
                || calendarAgeBP < calBP[0]
                || calendarAgeBP > calBP[calBP.length - 1]) {
            return Double.NaN;
        }
        return interpolateInside(calendarAgeBP, ys);
    }

    /** Interpolate a column at each of the given years; NaN where uncovered. */
    public double[] interpolate(int[] calendarYearsBP, Column column) {
        double[] out = new double[calendarYearsBP.length];
        for (int i = 0; i < out.length; i++) out[i] = interpolate(calendarYearsBP[i], column);
        return out;
    }

    /**
     * Interpolate a column at a calendar age, holding the first or last row's value
     * for ages outside the curve.
     */
    public double interpolateClamped(double calendarAgeBP, Column column) {
        double[] ys = values(column);
        if (calendarAgeBP <= calBP[0]) return ys[0];
        if (calendarAgeBP >= calBP[calBP.length - 1]) return ys[ys.length - 1];
        return interpolateInside(calendarAgeBP, ys);
    }

    /**
     * Fail unless the radiocarbon age lies between the curve's smallest and largest
     * radiocarbon ages.
     */
    public void requireRadiocarbonAge(double radiocarbonAgeBP) {
        if (radiocarbonAgeBP < minC14 || radiocarbonAgeBP > maxC14) {
            throw new CalibrationException(
                    ErrorKind.CURVE_RANGE_EXCEEDED,
                    String.format(
                            "Radiocarbon age %.1f is outside the range %.1f..%.1f of curve '%s'",
                            radiocarbonAgeBP, minC14, maxC14, name));
        }
    }

    /** Fail unless the calendar age lies inside the curve. */
    public void requireCalendarAge(double calendarAgeBP) {
        if (!(calendarAgeBP >= calBP[0] && calendarAgeBP <= calBP[calBP.length - 1])) {
            throw new CalibrationException(
                    ErrorKind.CURVE_RANGE_EXCEEDED,
                    String.format(
                            "Calendar age %.1f is outside the range %.1f..%.1f of curve '%s'",
                            calendarAgeBP, calBP[0], calBP[calBP.length - 1], name));
        }
    }

    /**
     * This curve expressed in fraction modern carbon: F = exp(age / -8033), with the
     * error propagated to first order. Computed once.
     */
    CalibrationCurve inF14C() {
        CalibrationCurve converted = f14c;
        if (converted == null) {
            int n = calBP.length;
            double[] f = new double[n];
            double[] fErr = new double[n];
            for (int i = 0; i < n; i++) {
                f[i] = ForwardCalibrator.toF14C(c14BP[i]);
                fErr[i] = f[i] * errorBP[i] / ForwardCalibrator.F14C_MEAN_LIFE;
            }
            converted = new CalibrationCurve(name, calBP, f, fErr);
            f14c = converted;
        }
        return converted;
    }

    /** Same rows under another name. */
    public CalibrationCurve withName(String newName) {
        return new CalibrationCurve(newName, calBP, c14BP, errorBP);
    }

    @Override
    public String toString() {
        return "CalibrationCurve[" + name + ", " + calBP.length + " rows, "
                + maxCalendarAge() + ".." + minCalendarAge() + " BP]";
    }

    private double[] values(Column column) {
        return column == Column.ERROR ? errorBP : c14BP;
    }

    private double interpolateInside(double x, double[] ys) {
        int hi = upperBound(calBP, x);
        if (calBP[hi] == x || hi == 0) return ys[hi];
        int lo = hi - 1;
        double t = (x - calBP[lo]) / (calBP[hi] - calBP[lo]);
        return ys[lo] + t * (ys[hi] - ys[lo]);
    }

    /**
     * Find the first index in a sorted array where arr[index] >= x.
     * If x is larger than all entries, returns the last index.
     */
    private static int upperBound(double[] arr, double x) {
        int lo = 0;
        int hi = arr.length - 1;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (arr[mid] < x) lo = mid + 1;
            else hi = mid;
        }
        return lo;
    }

    private static double[] reversed(double[] src) {
        double[] out = new double[src.length];
        for (int i = 0; i < src.length; i++) out[i] = src[src.length - 1 - i];
        return out;
    }
}
