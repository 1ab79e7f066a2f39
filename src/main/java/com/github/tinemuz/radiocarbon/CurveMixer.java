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

/**
 * Builds mixed terrestrial/marine calibration curves for samples with carbon from
 * both reservoirs.
 *
 * <p>The marine curve is resampled onto the terrestrial curve's calendar ages (holding
 * its end values beyond its range), shifted by the reservoir offset, and its error is
 * combined with the offset error in quadrature. Mean and error are then blended
 * linearly: {@code p * terrestrial + (1 - p) * marine}.</p>
 */
public final class CurveMixer {

    private CurveMixer() {}

    /**
     * Mix a built-in terrestrial curve with {@value CalibrationCurves#MARINE13}. Both
     * tables are loaded through {@link CalibrationCurves#load(String)} and must be
     * supplied by the application.
     *
     * @param terrestrialName built-in terrestrial curve, e.g. "intcal13"
     * @param p               terrestrial proportion in [0, 1]
     */
    public static CalibrationCurve mix(
            String terrestrialName, double p, double reservoirOffset, double reservoirOffsetError) {
        return mix(
                CalibrationCurves.load(terrestrialName),
                CalibrationCurves.load(CalibrationCurves.MARINE13),
                p,
                reservoirOffset,
                reservoirOffsetError);
    }

    /**
     * Mix two curves. The result has the terrestrial curve's calendar ages and is named
     * {@value CalibrationCurves#CUSTOM}.
     *
     * @param p terrestrial proportion in [0, 1]; 1 gives the terrestrial curve back
     */
    public static CalibrationCurve mix(
            CalibrationCurve terrestrial,
            CalibrationCurve marine,
            double p,
            double reservoirOffset,
            double reservoirOffsetError) {
        if (!(p >= 0 && p <= 1)) {
            throw new IllegalArgumentException("p must be in [0, 1]: " + p);
        }
        if (Double.isNaN(reservoirOffset) || Double.isNaN(reservoirOffsetError)) {
            throw new IllegalArgumentException("Reservoir offset and error must be numbers");
        }
        double[] cal = terrestrial.calendarAges();
        double[] c14 = terrestrial.radiocarbonAges();
        double[] err = terrestrial.errors();
        double[][] table = new double[cal.length][];
        for (int i = 0; i < cal.length; i++) {
            double marineMu =
                    marine.interpolateClamped(cal[i], Column.RADIOCARBON_AGE) + reservoirOffset;
            double marineErr = marine.interpolateClamped(cal[i], Column.ERROR);
            marineErr = Math.sqrt(marineErr * marineErr + reservoirOffsetError * reservoirOffsetError);
            double mu = p * c14[i] + (1 - p) * marineMu;
            double error = p * err[i] + (1 - p) * marineErr;
            table[i] = new double[] {cal[i], mu, error};
        }
        return CalibrationCurve.of(CalibrationCurves.CUSTOM, table);
    }
}
