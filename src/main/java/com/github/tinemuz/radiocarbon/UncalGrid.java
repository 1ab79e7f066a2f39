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
 * Probability density over integer radiocarbon ages, oldest first. Produced by
 * inverting a {@link CalGrid}; the raw likelihood and the unweighted reference
 * density used for the inversion are kept alongside the final density.
 */
public final class UncalGrid {

    private final int[] c14BP;
    private final double[] density;
    private final double[] raw;
    private final double[] base;

    UncalGrid(int[] c14BP, double[] density, double[] raw, double[] base) {
        this.c14BP = c14BP;
        this.density = density;
        this.raw = raw;
        this.base = base;
    }

    /**
     * Build a grid directly from radiocarbon ages and densities, for example a
     * summed distribution computed elsewhere.
     */
    public static UncalGrid of(int[] c14BP, double[] density) {
        if (c14BP.length != density.length) {
            throw new IllegalArgumentException(
                    "Ages (" + c14BP.length + ") and densities (" + density.length
                            + ") must be the same length");
        }
        Integer[] order = new Integer[c14BP.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        Arrays.sort(order, (a, b) -> Integer.compare(c14BP[b], c14BP[a]));
        int[] ages = new int[c14BP.length];
        double[] dens = new double[c14BP.length];
        for (int i = 0; i < order.length; i++) {
            ages[i] = c14BP[order[i]];
            dens[i] = density[order[i]];
            if (i > 0 && ages[i] == ages[i - 1]) {
                throw new IllegalArgumentException("Duplicate radiocarbon age " + ages[i]);
            }
            if (!(dens[i] >= 0)) {
                throw new IllegalArgumentException(
                        "Density at age " + ages[i] + " must be a non-negative number");
            }
        }
        return new UncalGrid(ages, dens, dens.clone(), new double[ages.length]);
    }

    public int size() {
        return c14BP.length;
    }

    public boolean isEmpty() {
        return c14BP.length == 0;
    }

    public int ageAt(int index) {
        return c14BP[index];
    }

    public double densityAt(int index) {
        return density[index];
    }

    /** Radiocarbon ages, oldest first. */
    public int[] c14BP() {
        return c14BP.clone();
    }

    public double[] density() {
        return density.clone();
    }

    /** Normalised, eps-floored calendar-weighted likelihood per age. */
    public double[] raw() {
        return raw.clone();
    }

    /** Unweighted sum of curve densities per age. */
    public double[] base() {
        return base.clone();
    }

    /** Density at a radiocarbon age; zero for ages the grid does not hold. */
    public double densityAtAge(int ageBP) {
        int lo = 0;
        int hi = c14BP.length - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int a = c14BP[mid];
            if (a == ageBP) return density[mid];
            if (a > ageBP) lo = mid + 1;
            else hi = mid - 1;
        }
        return 0.0;
    }

    public double sum() {
        double s = 0.0;
        for (double d : density) s += d;
        return s;
    }

    /** Age with the highest density. */
    public int modeAge() {
        if (isEmpty()) throw new IllegalStateException("Empty grid has no mode");
        int best = 0;
        for (int i = 1; i < density.length; i++) {
            if (density[i] > density[best]) best = i;
        }
        return c14BP[best];
    }

    @Override
    public String toString() {
        if (isEmpty()) return "UncalGrid[empty]";
        return "UncalGrid[" + c14BP.length + " ages, " + c14BP[0] + ".."
                + c14BP[c14BP.length - 1] + " BP]";
    }
}
