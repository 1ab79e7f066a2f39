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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Which curve each date of a batch is calibrated against: one built-in curve for all
 * dates, one custom curve for all dates, or a built-in curve named per date. A batch
 * can be backed by at most one custom curve.
 */
public final class CurveSelection {

    private final List<String> names; // one shared name or one per date; null for custom
    private final CalibrationCurve custom;

    private CurveSelection(List<String> names, CalibrationCurve custom) {
        this.names = names;
        this.custom = custom;
    }

    /** Every date uses the named built-in curve. */
    public static CurveSelection named(String name) {
        return new CurveSelection(List.of(Objects.requireNonNull(name, "name")), null);
    }

    /** Date {@code i} uses the built-in curve {@code names[i]}. */
    public static CurveSelection perDate(String... names) {
        return perDate(Arrays.asList(names));
    }

    public static CurveSelection perDate(List<String> names) {
        List<String> copy = new ArrayList<>(names);
        for (String n : copy) Objects.requireNonNull(n, "curve name");
        return new CurveSelection(Collections.unmodifiableList(copy), null);
    }

    /** Every date uses the given custom curve. */
    public static CurveSelection custom(CalibrationCurve curve) {
        return new CurveSelection(null, Objects.requireNonNull(curve, "curve"));
    }

    /** Every date uses a custom three-column table. */
    public static CurveSelection custom(double[][] table) {
        return custom(CalibrationCurves.custom(table));
    }

    public boolean isCustom() {
        return custom != null;
    }

    /**
     * Resolve one curve per date, loading each distinct built-in curve once.
     *
     * @throws CalibrationException {@link ErrorKind#INPUT_LENGTH_MISMATCH} if per-date
     *     names do not match the number of dates, {@link ErrorKind#UNKNOWN_CURVE_NAME} for
     *     unknown names
     */
    CalibrationCurve[] resolve(int dates) {
        CalibrationCurve[] out = new CalibrationCurve[dates];
        if (custom != null) {
            Arrays.fill(out, custom);
            return out;
        }
        if (names.size() != 1 && names.size() != dates) {
            throw new CalibrationException(
                    ErrorKind.INPUT_LENGTH_MISMATCH,
                    "Got " + names.size() + " curve names for " + dates + " dates");
        }
        Map<String, CalibrationCurve> loaded = new HashMap<>();
        for (String n : names) {
            if (!CalibrationCurves.isKnown(n)) {
                throw new CalibrationException(
                        ErrorKind.UNKNOWN_CURVE_NAME,
                        "calCurves must name known curves " + CalibrationCurves.knownNames()
                                + " or be a single custom three-column table; got '" + n + "'");
            }
        }
        for (int i = 0; i < dates; i++) {
            String n = names.size() == 1 ? names.get(0) : names.get(i);
            out[i] = loaded.computeIfAbsent(n, CalibrationCurves::load);
        }
        return out;
    }

    @Override
    public String toString() {
        return custom != null ? "CurveSelection[custom]" : "CurveSelection" + names;
    }
}
