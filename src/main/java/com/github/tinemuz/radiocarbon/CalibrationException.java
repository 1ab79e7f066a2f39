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
 * Raised when a calibration, uncalibration or curve operation cannot proceed.
 *
 * <p>The {@link ErrorKind} tells callers which class of problem occurred without
 * having to parse the message. All validation failures of a batch are raised before
 * any date is processed, so a caught exception never comes with partial results.</p>
 */
public class CalibrationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Failure categories. */
    public enum ErrorKind {
        /** Parallel input arrays disagree in length. */
        INPUT_LENGTH_MISMATCH,
        /** Date identifiers are not unique. */
        DUPLICATE_IDENTIFIER,
        /** A required numeric input is NaN. */
        MISSING_VALUE,
        /** A custom curve table is not a three-column numeric table. */
        INVALID_CURVE_FORMAT,
        /** A curve name is not one of the built-in curves. */
        UNKNOWN_CURVE_NAME,
        /** A requested age lies outside the curve's domain. */
        CURVE_RANGE_EXCEEDED,
        /** The requested time window cannot be fully covered for a date. */
        DATE_OUT_OF_CALIBRATION_RANGE,
        /**
         * Options that cannot be used together. F14C with normalisation off is not
         * reported this way: {@link CalibrationOptions.Builder#build()} turns
         * normalisation on and logs a warning.
         */
        INVALID_PARAMETER_COMBINATION,
        /** An unknown grid inversion strategy was requested. */
        UNSUPPORTED_INVERSION_MODE
    }

    private final ErrorKind kind;

    public CalibrationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CalibrationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }
}
