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

import static org.junit.jupiter.api.Assertions.*;

import com.github.tinemuz.radiocarbon.CalibrationException.ErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class GridCalibratorTest {

    private final CalibrationCurve identity = TestCurves.identity(20);

    @Nested
    @DisplayName("Fast inversion")
    class FastTests {

        @Test
        @DisplayName("Each year takes the density at its rounded curve age")
        void lookup() {
            UncalGrid g = UncalGrid.of(new int[] {3999, 4000, 4001}, new double[] {0.25, 0.5, 0.25});
            CalGrid cal =
                    GridCalibrator.calibrate(
                            g, identity, InversionStrategy.FAST, TestCurves.window(4500, 3500));

            assertEquals(3, cal.size());
            assertEquals(0.5, cal.densityAtYear(4000), 1e-12);
            assertEquals(0.25, cal.densityAtYear(4001), 1e-12);
            assertEquals(0.0, cal.densityAtYear(4100));
        }

        @Test
        @DisplayName("Back-calibrated grids return close to where they started")
        void roundTrip() {
            CalGrid start =
                    ForwardCalibrator.calibrate(4000, 30, identity, TestCurves.window(4500, 3500));
            UncalGrid u = Uncalibrator.uncalibrate(start, identity, 1e-5, true);
            CalGrid back =
                    GridCalibrator.calibrate(
                            u, identity, InversionStrategy.FAST, TestCurves.window(4500, 3500));

            assertEquals(4000, back.modeYear(), 2);
            assertEquals(1.0, back.sum(), 1e-9);
        }

        @Test
        @DisplayName("Per-date normalisation is ignored")
        void dateNormalisedIgnored() {
            UncalGrid g = UncalGrid.of(new int[] {4000}, new double[] {1});
            CalibrationOptions opts = TestCurves.window(4500, 3500);
            CalGrid plain =
                    GridCalibrator.calibrate(
                            g, new double[] {0}, identity, InversionStrategy.FAST, opts, false);
            CalGrid flagged =
                    GridCalibrator.calibrate(
                            g, new double[] {0}, identity, InversionStrategy.FAST, opts, true);

            assertArrayEquals(plain.density(), flagged.density());
        }
    }

    @Nested
    @DisplayName("Full inversion")
    class FullTests {

        @Test
        @DisplayName("A single-age grid matches forward calibration of that age")
        void singleAge() {
            CalibrationOptions opts =
                    TestCurves.window(4500, 3500).toBuilder().compact(false).build();
            CalGrid viaGrid =
                    GridCalibrator.calibrate(
                            UncalGrid.of(new int[] {4000}, new double[] {1}),
                            new double[] {30},
                            identity,
                            InversionStrategy.FULL,
                            opts,
                            true);
            CalGrid direct = ForwardCalibrator.calibrate(4000, 30, identity, opts);

            assertArrayEquals(direct.calBP(), viaGrid.calBP());
            assertArrayEquals(direct.density(), viaGrid.density(), 1e-12);
        }

        @Test
        @DisplayName("Weights mix the per-age calibrations")
        void weighted() {
            CalibrationOptions opts = TestCurves.window(4500, 3500);
            CalGrid g =
                    GridCalibrator.calibrate(
                            UncalGrid.of(new int[] {3800, 4200}, new double[] {0.5, 0.5}),
                            new double[] {25},
                            identity,
                            InversionStrategy.FULL,
                            opts,
                            true);

            assertEquals(1.0, g.sum(), 1e-9);
            assertEquals(g.densityAtYear(3800), g.densityAtYear(4200), 1e-12);
            assertTrue(g.densityAtYear(4000) < g.densityAtYear(3800));
        }

        @Test
        @DisplayName("Errors must match the grid")
        void errorLength() {
            UncalGrid g = UncalGrid.of(new int[] {3900, 4000}, new double[] {0.5, 0.5});
            CalibrationException e =
                    assertThrows(
                            CalibrationException.class,
                            () -> GridCalibrator.calibrate(
                                    g, new double[] {10, 20, 30}, identity,
                                    InversionStrategy.FULL, TestCurves.window(4500, 3500), false));
            assertEquals(ErrorKind.INPUT_LENGTH_MISMATCH, e.kind());
        }

        @Test
        @DisplayName("Grid ages outside the curve fail")
        void ageOutsideCurve() {
            UncalGrid g = UncalGrid.of(new int[] {4000, 7000}, new double[] {0.5, 0.5});
            CalibrationException e =
                    assertThrows(
                            CalibrationException.class,
                            () -> GridCalibrator.calibrate(
                                    g, identity, InversionStrategy.FULL,
                                    TestCurves.window(4500, 3500)));
            assertEquals(ErrorKind.CURVE_RANGE_EXCEEDED, e.kind());
        }
    }

    @Test
    @DisplayName("Windows past the curve fail")
    void windowBeyondCurve() {
        UncalGrid g = UncalGrid.of(new int[] {4000}, new double[] {1});
        CalibrationException e =
                assertThrows(
                        CalibrationException.class,
                        () -> GridCalibrator.calibrate(
                                g, identity, InversionStrategy.FAST, TestCurves.window(8000, 3500)));
        assertEquals(ErrorKind.DATE_OUT_OF_CALIBRATION_RANGE, e.kind());
    }

    @Test
    @DisplayName("Strategy names are parsed case-insensitively")
    void parseStrategy() {
        assertEquals(InversionStrategy.FAST, InversionStrategy.parse("fast"));
        assertEquals(InversionStrategy.FULL, InversionStrategy.parse("Full"));
        CalibrationException e =
                assertThrows(CalibrationException.class, () -> InversionStrategy.parse("slow"));
        assertEquals(ErrorKind.UNSUPPORTED_INVERSION_MODE, e.kind());
    }
}
