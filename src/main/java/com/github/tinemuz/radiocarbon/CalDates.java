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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A set of calibrated dates: one {@link DateRecord} per date, in input order, and the
 * densities in exactly one of two forms, chosen when the store is created: a
 * {@link CalGrid} per date ({@link StorageMode#SPARSE}) or a shared {@link CalMatrix}
 * with one column per date ({@link StorageMode#DENSE}).
 *
 * <p>Stores are read-only. Subsetting returns a new store holding the selected rows in
 * the order they were asked for.</p>
 */
public final class CalDates {

    private final List<DateRecord> metadata;
    private final Map<String, CalGrid> grids; // null in dense mode
    private final CalMatrix matrix; // null in sparse mode
    private final Map<String, Integer> indexById;

    private CalDates(List<DateRecord> metadata, Map<String, CalGrid> grids, CalMatrix matrix) {
        this.metadata = Collections.unmodifiableList(new ArrayList<>(metadata));
        this.grids = grids == null ? null : Collections.unmodifiableMap(grids);
        this.matrix = matrix;
        Map<String, Integer> idx = new HashMap<>();
        for (int i = 0; i < this.metadata.size(); i++) {
            if (idx.put(this.metadata.get(i).dateId(), i) != null) {
                throw new IllegalArgumentException(
                        "Duplicate date id " + this.metadata.get(i).dateId());
            }
        }
        this.indexById = idx;
    }

    /**
     * Store holding one grid per date.
     *
     * @param grids grids in the same order as {@code metadata}
     */
    public static CalDates sparse(List<DateRecord> metadata, List<CalGrid> grids) {
        if (metadata.size() != grids.size()) {
            throw new IllegalArgumentException(
                    metadata.size() + " metadata rows but " + grids.size() + " grids");
        }
        Map<String, CalGrid> byId = new LinkedHashMap<>();
        for (int i = 0; i < metadata.size(); i++) {
            byId.put(metadata.get(i).dateId(), Objects.requireNonNull(grids.get(i), "grid"));
        }
        return new CalDates(metadata, byId, null);
    }

    /** Store holding a matrix with one column per date. */
    public static CalDates dense(List<DateRecord> metadata, CalMatrix matrix) {
        if (metadata.size() != matrix.columns()) {
            throw new IllegalArgumentException(
                    metadata.size() + " metadata rows but " + matrix.columns() + " columns");
        }
        return new CalDates(metadata, null, matrix);
    }

    public int size() {
        return metadata.size();
    }

    public boolean isEmpty() {
        return metadata.isEmpty();
    }

    public StorageMode storageMode() {
        return matrix != null ? StorageMode.DENSE : StorageMode.SPARSE;
    }

    public List<DateRecord> metadata() {
        return metadata;
    }

    public DateRecord record(int index) {
        return metadata.get(index);
    }

    /** Position of a date, or -1 if the store does not hold it. */
    public int indexOf(String dateId) {
        Integer i = indexById.get(dateId);
        return i == null ? -1 : i;
    }

    /**
     * Grids keyed by date id in input order.
     *
     * @throws IllegalStateException for a dense store
     */
    public Map<String, CalGrid> grids() {
        if (grids == null) {
            throw new IllegalStateException("Dates are stored as a matrix, not as grids");
        }
        return grids;
    }

    /**
     * The matrix with one column per date.
     *
     * @throws IllegalStateException for a sparse store
     */
    public CalMatrix matrix() {
        if (matrix == null) {
            throw new IllegalStateException("Dates are stored as grids, not as a matrix");
        }
        return matrix;
    }

    /** A date's density; read from its matrix column's non-zero rows in a dense store. */
    public CalGrid grid(int index) {
        if (matrix != null) {
            Objects.checkIndex(index, metadata.size());
            return matrix.columnGrid(index);
        }
        return grids.get(metadata.get(index).dateId());
    }

    public CalGrid grid(String dateId) {
        int i = indexOf(dateId);
        if (i < 0) throw new IllegalArgumentException("No date with id " + dateId);
        return grid(i);
    }

    /** New store with the dates at the given positions. */
    public CalDates subset(int... indices) {
        requireData();
        for (int i : indices) Objects.checkIndex(i, metadata.size());
        List<DateRecord> meta = new ArrayList<>(indices.length);
        for (int i : indices) meta.add(metadata.get(i));
        if (matrix != null) {
            return new CalDates(meta, null, matrix.selectColumns(indices));
        }
        Map<String, CalGrid> sub = new LinkedHashMap<>();
        for (DateRecord r : meta) sub.put(r.dateId(), grids.get(r.dateId()));
        return new CalDates(meta, sub, null);
    }

    /** New store with the given dates. */
    public CalDates subset(String... dateIds) {
        requireData();
        int[] indices = new int[dateIds.length];
        for (int k = 0; k < dateIds.length; k++) {
            int i = indexOf(dateIds[k]);
            if (i < 0) throw new IllegalArgumentException("No date with id " + dateIds[k]);
            indices[k] = i;
        }
        return subset(indices);
    }

    /** New store with the dates whose mask entry is true. */
    public CalDates subset(boolean[] mask) {
        requireData();
        if (mask.length != metadata.size()) {
            throw new IllegalArgumentException(
                    "Mask length " + mask.length + " does not match " + metadata.size() + " dates");
        }
        int n = 0;
        for (boolean b : mask) if (b) n++;
        int[] indices = new int[n];
        int j = 0;
        for (int i = 0; i < mask.length; i++) if (mask[i]) indices[j++] = i;
        return subset(indices);
    }

    private void requireData() {
        if (metadata.isEmpty()) throw new IllegalStateException("No data to extract");
    }

    @Override
    public String toString() {
        return "CalDates[" + metadata.size() + " dates, " + storageMode() + "]";
    }
}
