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

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Settings shared by every date of a calibration: the calendar window kept, the
 * likelihood model, normalisation, the density floor and whether zero rows are
 * dropped. Immutable; use {@link #builder()}.
 */
public final class CalibrationOptions {
    private static final Logger log = LoggerFactory.getLogger(CalibrationOptions.class);

    /** Default density floor. */
    public static final double DEFAULT_EPS = 1e-5;

    private static final CalibrationOptions DEFAULTS = builder().build();

    private final TimeRange timeRange;
    private final boolean normalised;
    private final LikelihoodModel model;
    private final double eps;
    private final boolean compact;

    private CalibrationOptions(Builder b) {
        this.timeRange = b.timeRange;
        this.normalised = b.normalised;
        this.model = b.model;
        this.eps = b.eps;
        this.compact = b.compact;
    }

    /** 50000..0 BP, normalised, radiocarbon-age likelihood, eps 1e-5, compacted. */
    public static CalibrationOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public TimeRange timeRange() {
        return timeRange;
    }

    public boolean normalised() {
        return normalised;
    }

    public LikelihoodModel model() {
        return model;
    }

    public boolean useF14C() {
        return model == LikelihoodModel.F14C;
    }

    public double eps() {
        return eps;
    }

    public boolean compact() {
        return compact;
    }

    /** Builder pre-filled with these settings. */
    public Builder toBuilder() {
        return new Builder()
                .timeRange(timeRange)
                .normalised(normalised)
                .model(model)
                .eps(eps)
                .compact(compact);
    }

    @Override
    public String toString() {
        return "CalibrationOptions[timeRange=" + timeRange + ", normalised=" + normalised
                + ", model=" + model + ", eps=" + eps + ", compact=" + compact + "]";
    }

    public static final class Builder {
        private TimeRange timeRange = TimeRange.DEFAULT;
        private boolean normalised = true;
        private LikelihoodModel model = LikelihoodModel.RADIOCARBON_AGE;
        private double eps = DEFAULT_EPS;
        private boolean compact = true;

        private Builder() {}

        public Builder timeRange(TimeRange timeRange) {
            this.timeRange = Objects.requireNonNull(timeRange, "timeRange");
            return this;
        }

        public Builder timeRange(int startBP, int endBP) {
            return timeRange(new TimeRange(startBP, endBP));
        }

        public Builder normalised(boolean normalised) {
            this.normalised = normalised;
            return this;
        }

        public Builder model(LikelihoodModel model) {
            this.model = Objects.requireNonNull(model, "model");
            return this;
        }

        public Builder useF14C(boolean useF14C) {
            return model(useF14C ? LikelihoodModel.F14C : LikelihoodModel.RADIOCARBON_AGE);
        }

        public Builder eps(double eps) {
            if (!(eps >= 0)) {
                throw new IllegalArgumentException("eps must be a non-negative number: " + eps);
            }
            this.eps = eps;
            return this;
        }

        public Builder compact(boolean compact) {
            this.compact = compact;
            return this;
        }

        /**
         * Build the options. F14C densities are only meaningful normalised, so an
         * F14C request with normalisation off is switched to normalised with a warning.
         */
        public CalibrationOptions build() {
            if (model == LikelihoodModel.F14C && !normalised) {
                log.warn(
                        "normalised cannot be false when calibrating in F14C space; "
                                + "calibrating with normalised=true");
                normalised = true;
            }
            return new CalibrationOptions(this);
        }
    }
}
