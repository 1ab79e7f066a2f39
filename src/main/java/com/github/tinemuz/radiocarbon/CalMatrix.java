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
 * Dense densities for many dates: one row per calendar year of a window (oldest
 * first), one column per date. Years a date's grid does not hold are zero.
 *
 * <p>Columns are written once while a batch is built, each by a single worker, and
 * never change afterwards.</p>
 */
public final class CalMatrix {

    private final TimeRange range;
    private final double[][] values; // [row][column]
    private final int columns;

    CalMatrix(TimeRange range, int columns) {
        this.range = range;
        this.columns = columns;
        this.values = new double[range.years()][columns];
    }

    private CalMatrix(TimeRange range, double[][] values, int columns) {
        this.range = range;
        this.values = values;
        this.columns = columns;
    }

    public TimeRange timeRange() {
        return range;
    }

    public int rows() {
        return values.length;
    }

    public int columns() {
        return columns;
    }

    public int yearAt(int row) {
        return range.startBP() - row;
    }

    /** Row holding a calendar year, or -1 outside the window. */
    public int rowOf(int yearBP) {
        return range.contains(yearBP) ? range.startBP() - yearBP : -1;
    }

    public double get(int row, int column) {
        return values[row][column];
    }

    /** Density of a date at a year; zero outside the window. */
    public double getAtYear(int yearBP, int column) {
        int row = rowOf(yearBP);
        return row < 0 ? 0.0 : values[row][column];
    }

    /** Copy of one date's column. */
    public double[] column(int column) {
        double[] out = new double[values.length];
        for (int r = 0; r < out.length; r++) out[r] = values[r][column];
        return out;
    }

    /** One date's non-zero rows as a grid. */
    public CalGrid columnGrid(int column) {
        int n = values.length;
        int[] years = new int[n];
        double[] dens = new double[n];
        for (int r = 0; r < n; r++) {
            years[r] = yearAt(r);
            dens[r] = values[r][column];
        }
        return new CalGrid(years, dens).compact();
    }

    /** New matrix with the given columns, in the given order. */
    public CalMatrix selectColumns(int[] columnIndices) {
        double[][] out = new double[values.length][columnIndices.length];
        for (int r = 0; r < values.length; r++) {
            double[] src = values[r];
            double[] dst = out[r];
            for (int c = 0; c < columnIndices.length; c++) dst[c] = src[columnIndices[c]];
        }
        return new CalMatrix(range, out, columnIndices.length);
    }

    /**
     * Write a date's grid into its column. Years outside the window are ignored.
     */
    void scatter(int column, CalGrid grid) {
        for (int i = 0; i < grid.size(); i++) {
            int row = rowOf(grid.yearAt(i));
            if (row >= 0) values[row][column] = grid.densityAt(i);
        }
    }

    @Override
    public String toString() {
        return "CalMatrix[" + values.length + " x " + columns + ", " + range.startBP() + ".."
                + range.endBP() + " BP]";
    }
}
