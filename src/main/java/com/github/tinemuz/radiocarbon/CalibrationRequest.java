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

import java.util.List;
import java.util.Objects;

/**
 * Input of a batch calibration: the measurements with their optional ids, details and
 * reservoir offsets, the curve selection, shared {@link CalibrationOptions}, the
 * storage mode of the result and the number of worker threads.
 *
 * <p>Reservoir offsets and their errors may be given once for all dates or once per
 * date. Array lengths are checked by {@link BatchCalibrator}, not here, so a request
 * can be assembled piecemeal.</p>
 */
public final class CalibrationRequest {

    private final double[] ages;
    private final double[] errors;
    private final String[] ids;
    private final Object[] details;
    private final CurveSelection curves;
    private final double[] reservoirOffsets;
    private final double[] reservoirOffsetErrors;
    private final CalibrationOptions options;
    private final StorageMode storage;
    private final int workers;
    private final ProgressReporter reporter;

    private CalibrationRequest(Builder b) {
        this.ages = b.ages;
        this.errors = b.errors;
        this.ids = b.ids;
        this.details = b.details;
        this.curves = b.curves;
        this.reservoirOffsets = b.reservoirOffsets;
        this.reservoirOffsetErrors = b.reservoirOffsetErrors;
        this.options = b.options;
        this.storage = b.storage;
        this.workers = b.workers;
        this.reporter = b.reporter;
    }

    /**
     * Start a request for parallel arrays of radiocarbon ages and errors. Unless
     * {@link Builder#curves} or one of the {@code curve} setters is called, dates are
     * calibrated against {@value CalibrationCurves#INTCAL13}, whose table must be
     * supplied as described in {@link CalibrationCurves}.
     */
    public static Builder builder(double[] ages, double[] errors) {
        return new Builder(ages, errors);
    }

    public int size() {
        return ages.length;
    }

    double[] ages() {
        return ages;
    }

    double[] errors() {
        return errors;
    }

    /** Ids, or null when dates are to be numbered 1..n. */
    String[] ids() {
        return ids;
    }

    Object[] details() {
        return details;
    }

    public CurveSelection curves() {
        return curves;
    }

    double[] reservoirOffsets() {
        return reservoirOffsets;
    }

    double[] reservoirOffsetErrors() {
        return reservoirOffsetErrors;
    }

    public CalibrationOptions options() {
        return options;
    }

    public StorageMode storage() {
        return storage;
    }

    public int workers() {
        return workers;
    }

    public ProgressReporter reporter() {
        return reporter;
    }

    public static final class Builder {
        private final double[] ages;
        private final double[] errors;
        private String[] ids;
        private Object[] details;
        private CurveSelection curves = CurveSelection.named(CalibrationCurves.INTCAL13);
        private double[] reservoirOffsets = {0.0};
        private double[] reservoirOffsetErrors = {0.0};
        private CalibrationOptions options = CalibrationOptions.defaults();
        private StorageMode storage = StorageMode.SPARSE;
        private int workers = 1;
        private ProgressReporter reporter = ProgressReporter.NONE;

        private Builder(double[] ages, double[] errors) {
            this.ages = Objects.requireNonNull(ages, "ages").clone();
            this.errors = Objects.requireNonNull(errors, "errors").clone();
        }

        public Builder ids(String... ids) {
            this.ids = ids == null ? null : ids.clone();
            return this;
        }

        public Builder ids(List<String> ids) {
            return ids(ids == null ? null : ids.toArray(new String[0]));
        }

        public Builder details(Object... details) {
            this.details = details == null ? null : details.clone();
            return this;
        }

        public Builder curves(CurveSelection curves) {
            this.curves = Objects.requireNonNull(curves, "curves");
            return this;
        }

        public Builder curve(String name) {
            return curves(CurveSelection.named(name));
        }

        public Builder curve(CalibrationCurve custom) {
            return curves(CurveSelection.custom(custom));
        }

        /** One offset for every date, or one per date. */
        public Builder reservoirOffsets(double... offsets) {
            this.reservoirOffsets = Objects.requireNonNull(offsets, "offsets").clone();
            return this;
        }

        /** One offset error for every date, or one per date. */
        public Builder reservoirOffsetErrors(double... offsetErrors) {
            this.reservoirOffsetErrors =
                    Objects.requireNonNull(offsetErrors, "offsetErrors").clone();
            return this;
        }

        public Builder options(CalibrationOptions options) {
            this.options = Objects.requireNonNull(options, "options");
            return this;
        }

        public Builder storage(StorageMode storage) {
            this.storage = Objects.requireNonNull(storage, "storage");
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder reporter(ProgressReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        public CalibrationRequest build() {
            return new CalibrationRequest(this);
        }
    }

    @Override
    public String toString() {
        return "CalibrationRequest[" + ages.length + " dates, curves=" + curves + ", "
                + options + ", storage=" + storage + ", workers=" + workers + "]";
    }
}
