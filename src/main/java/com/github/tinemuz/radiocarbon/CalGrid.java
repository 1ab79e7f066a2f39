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

import java.util.Arrays;

/**
 * Probability density over integer calendar years BP for a single date (or an
 * aggregate of dates). Years run oldest first. A compacted grid omits years with
 * zero density; it is equivalent to the full grid padded with zeros.
 */
public final class CalGrid {

    private final int[] calBP;
    private final double[] density;

    CalGrid(int[] calBP, double[] density) {
        this.calBP = calBP;
        this.density = density;
    }

    /**
     * Build a grid from parallel arrays of years and densities. Rows are reordered
     * oldest first.
     *
     * @throws IllegalArgumentException if the arrays differ in length, a year repeats
     *     or a density is negative or NaN
     */
    public static CalGrid of(int[] calBP, double[] density) {
        if (calBP.length != density.length) {
            throw new IllegalArgumentException(
                    "Years (" + calBP.length + ") and densities (" + density.length
                            + ") must be the same length");
        }
        Integer[] order = new Integer[calBP.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Integer.compare(calBP[b], calBP[a]));
        int[] years = new int[calBP.length];
        double[] dens = new double[calBP.length];
        for (int i = 0; i < order.length; i++) {
            years[i] = calBP[order[i]];
            dens[i] = density[order[i]];
            if (i > 0 && years[i] == years[i - 1]) {
                throw new IllegalArgumentException("Duplicate calendar year " + years[i]);
            }
            if (!(dens[i] >= 0)) {
                throw new IllegalArgumentException(
                        "Density at year " + years[i] + " must be a non-negative number");
            }
        }
        return new CalGrid(years, dens);
    }

    public int size() {
        return calBP.length;
    }

    public boolean isEmpty() {
        return calBP.length == 0;
    }

    public int yearAt(int index) {
        return calBP[index];
    }

    public double densityAt(int index) {
        return density[index];
    }

    /** Years, oldest first. */
    public int[] calBP() {
        return calBP.clone();
    }

    public double[] density() {
        return density.clone();
    }

    /** Density at a calendar year; zero for years the grid does not hold. */
    public double densityAtYear(int yearBP) {
        int lo = 0;
        int hi = calBP.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int y = calBP[mid];
            if (y == yearBP) return density[mid];
            if (y > yearBP) lo = mid + 1;
            else hi = mid - 1;
        }
        return 0.0;
    }

    public double sum() {
        double s = 0.0;
        for (double d : density) s += d;
        return s;
    }

    /** Year with the highest density (oldest one on ties). */
    public int modeYear() {
        if (isEmpty()) throw new IllegalStateException("Empty grid has no mode");
        int best = 0;
        for (int i = 1; i < density.length; i++) {
            if (density[i] > density[best]) best = i;
        }
        return calBP[best];
    }

    /** Copy without the zero-density rows. */
    public CalGrid compact() {
        int n = 0;
        for (double d : density) if (d > 0) n++;
        if (n == density.length) return this;
        int[] years = new int[n];
        double[] dens = new double[n];
        int j = 0;
        for (int i = 0; i < density.length; i++) {
            if (density[i] > 0) {
                years[j] = calBP[i];
                dens[j++] = density[i];
            }
        }
        return new CalGrid(years, dens);
    }

    @Override
    public String toString() {
        if (isEmpty()) return "CalGrid[empty]";
        return "CalGrid[" + calBP.length + " years, " + calBP[0] + ".."
                + calBP[calBP.length - 1] + " BP]";
    }
}
