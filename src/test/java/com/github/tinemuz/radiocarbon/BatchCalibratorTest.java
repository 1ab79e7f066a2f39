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
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class BatchCalibratorTest {

    private static final double[] AGES = {3800, 4000, 4250};
    private static final double[] ERRORS = {30, 25, 40};
    private static final String[] IDS = {"a", "b", "c"};

    private final CalibrationCurve identity = TestCurves.identity(20);

    private CalibrationRequest.Builder request() {
        return CalibrationRequest.builder(AGES, ERRORS)
                .ids(IDS)
                .curve(identity)
                .options(TestCurves.window(4600, 3400));
    }

    @Nested
    @DisplayName("Storage modes")
    class StorageTests {

        @Test
        @DisplayName("Dense matrix has one column per date and one row per window year")
        void denseShape() {
            CalDates dates = BatchCalibrator.calibrate(request().storage(StorageMode.DENSE).build());

            assertEquals(StorageMode.DENSE, dates.storageMode());
            CalMatrix m = dates.matrix();
            assertEquals(3, m.columns());
            assertEquals(4600 - 3400 + 1, m.rows());
            assertEquals(4600, m.yearAt(0));
            assertEquals(3400, m.yearAt(m.rows() - 1));
        }

        @Test
        @DisplayName("Sparse grids scattered into a matrix reproduce the dense matrix")
        void sparseMatchesDense() {
            CalDates dense = BatchCalibrator.calibrate(request().storage(StorageMode.DENSE).build());
            CalDates sparse =
                    BatchCalibrator.calibrate(request().storage(StorageMode.SPARSE).build());

            assertEquals(3, sparse.grids().size());
            CalMatrix rebuilt = new CalMatrix(new TimeRange(4600, 3400), 3);
            for (int i = 0; i < 3; i++) {
                CalGrid g = sparse.grids().get(IDS[i]);
                for (int r = 0; r < g.size(); r++) assertTrue(g.densityAt(r) > 0);
                rebuilt.scatter(i, g);
            }
            CalMatrix m = dense.matrix();
            for (int r = 0; r < m.rows(); r++) {
                for (int c = 0; c < 3; c++) {
                    assertEquals(m.get(r, c), rebuilt.get(r, c), "row " + r + " col " + c);
                }
            }
        }

        @Test
        @DisplayName("Parallel workers give the same result as one worker")
        void parallelMatchesSequential() {
            double[] ages = new double[40];
            double[] errors = new double[40];
            for (int i = 0; i < ages.length; i++) {
                ages[i] = 3600 + i * 20;
                errors[i] = 20 + i % 7;
            }
            CalibrationRequest.Builder b =
                    CalibrationRequest.builder(ages, errors)
                            .curve(identity)
                            .options(TestCurves.window(4800, 3200))
                            .storage(StorageMode.DENSE);
            CalDates one = BatchCalibrator.calibrate(b.workers(1).build());
            CalDates many = BatchCalibrator.calibrate(b.workers(4).build());

            for (int c = 0; c < ages.length; c++) {
                assertArrayEquals(one.matrix().column(c), many.matrix().column(c));
            }
        }
    }

    @Nested
    @DisplayName("Metadata")
    class MetadataTests {

        @Test
        @DisplayName("One record per date in input order")
        void records() {
            CalDates dates =
                    BatchCalibrator.calibrate(
                            request().details("x", 2, null).reservoirOffsets(0, 10, 20).build());

            assertEquals(3, dates.size());
            DateRecord b = dates.record(1);
            assertEquals("b", b.dateId());
            assertEquals(4000, b.radiocarbonAge());
            assertEquals(25, b.error());
            assertEquals(2, b.details());
            assertEquals("custom", b.calCurve());
            assertEquals(10, b.reservoirOffset());
            assertEquals(0, b.reservoirOffsetError());
            assertEquals(4600, b.startBP());
            assertEquals(3400, b.endBP());
            assertTrue(b.normalised());
            assertFalse(b.f14c());
            assertEquals(CalibrationOptions.DEFAULT_EPS, b.eps());
            assertNull(dates.record(2).details());
        }

        @Test
        @DisplayName("Ids default to 1..n")
        void defaultIds() {
            CalDates dates =
                    BatchCalibrator.calibrate(
                            CalibrationRequest.builder(AGES, ERRORS)
                                    .curve(identity)
                                    .options(TestCurves.window(4600, 3400))
                                    .build());

            assertEquals("1", dates.record(0).dateId());
            assertEquals("3", dates.record(2).dateId());
            assertNotNull(dates.grid("2"));
        }

        @Test
        @DisplayName("F14C without normalisation is recorded as normalised")
        void f14cForcesNormalised() {
            CalibrationOptions opts =
                    TestCurves.window(4600, 3400).toBuilder()
                            .useF14C(true)
                            .normalised(false)
                            .build();
            CalDates dates = BatchCalibrator.calibrate(request().options(opts).build());

            assertTrue(dates.record(0).normalised());
            assertTrue(dates.record(0).f14c());
            assertEquals(1.0, dates.grid(0).sum(), 1e-9);
        }

        @Test
        @DisplayName("Curves can be named per date")
        void perDateCurves() {
            CalDates dates =
                    BatchCalibrator.calibrate(
                            CalibrationRequest.builder(new double[] {3000, 3000}, new double[] {30, 30})
                                    .curves(CurveSelection.perDate("intcal13", "normal"))
                                    .options(TestCurves.window(5000, 1000))
                                    .build());

            assertEquals("intcal13", dates.record(0).calCurve());
            assertEquals("normal", dates.record(1).calCurve());
            assertEquals(3000, SummaryStatistics.median(dates.grid(1)));
        }
    }

    @Nested
    @DisplayName("Progress reporting")
    class ProgressTests {

        @Test
        @DisplayName("Every date is reported once, from any worker")
        void reportsEachDate() {
            CountingReporter reporter = new CountingReporter();
            BatchCalibrator.calibrate(request().workers(3).reporter(reporter).build());

            assertEquals(3, reporter.started.get());
            assertEquals(Set.of("a", "b", "c"), reporter.ids);
            assertEquals(1, reporter.finished.get());
        }

        @Test
        @DisplayName("Dates are calibrated on the worker pool, not the calling thread")
        void runsOnWorkerThreads() {
            double[] ages = new double[40];
            double[] errors = new double[40];
            for (int i = 0; i < ages.length; i++) {
                ages[i] = 3600 + i * 20;
                errors[i] = 25;
            }
            CountingReporter reporter = new CountingReporter();
            CalDates dates =
                    BatchCalibrator.calibrate(
                            CalibrationRequest.builder(ages, errors)
                                    .curve(identity)
                                    .options(TestCurves.window(4800, 3200))
                                    .workers(4)
                                    .reporter(reporter)
                                    .build());

            assertEquals(40, dates.size());
            assertEquals(40, reporter.ids.size());
            assertFalse(reporter.threads.isEmpty());
            for (String name : reporter.threads) {
                assertTrue(name.startsWith("calibrate-worker-"), "calibrated on " + name);
            }
            assertTrue(reporter.threads.size() <= 4);
        }

        @Test
        @DisplayName("Logging reporter counts completed dates")
        void loggingReporter() {
            LoggingProgressReporter reporter = new LoggingProgressReporter(2);
            BatchCalibrator.calibrate(request().reporter(reporter).build());

            assertEquals(3, reporter.completed());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Ages and errors of different lengths")
        void lengthMismatch() {
            assertKind(
                    ErrorKind.INPUT_LENGTH_MISMATCH,
                    CalibrationRequest.builder(new double[] {4000, 4100}, new double[] {30})
                            .curve(identity));
            assertKind(ErrorKind.INPUT_LENGTH_MISMATCH, request().ids("a", "b"));
            assertKind(ErrorKind.INPUT_LENGTH_MISMATCH, request().reservoirOffsets(1, 2));
            assertKind(ErrorKind.INPUT_LENGTH_MISMATCH, request().details("only one"));
            assertKind(
                    ErrorKind.INPUT_LENGTH_MISMATCH,
                    request().curves(CurveSelection.perDate("intcal13", "normal")));
        }

        @Test
        @DisplayName("NaN ages or errors")
        void missingValues() {
            assertKind(
                    ErrorKind.MISSING_VALUE,
                    CalibrationRequest.builder(new double[] {4000, Double.NaN}, new double[] {30, 30})
                            .curve(identity));
            assertKind(
                    ErrorKind.MISSING_VALUE,
                    CalibrationRequest.builder(new double[] {4000}, new double[] {Double.NaN})
                            .curve(identity));
        }

        @Test
        @DisplayName("Repeated ids")
        void duplicateIds() {
            assertKind(ErrorKind.DUPLICATE_IDENTIFIER, request().ids("a", "b", "a"));
        }

        @Test
        @DisplayName("Unknown curve names")
        void unknownCurve() {
            assertKind(ErrorKind.UNKNOWN_CURVE_NAME, request().curve("intcal99"));
            assertKind(
                    ErrorKind.UNKNOWN_CURVE_NAME,
                    request().curves(CurveSelection.perDate("intcal13", "bogus", "normal")));
        }

        @Test
        @DisplayName("Ages outside the curve fail before any date is calibrated")
        void curveRangeFailsEarly() {
            CountingReporter reporter = new CountingReporter();
            CalibrationRequest r =
                    CalibrationRequest.builder(new double[] {4000, 9000}, new double[] {30, 30})
                            .curve(identity)
                            .options(TestCurves.window(4600, 3400))
                            .reporter(reporter)
                            .build();

            CalibrationException e =
                    assertThrows(CalibrationException.class, () -> BatchCalibrator.calibrate(r));
            assertEquals(ErrorKind.CURVE_RANGE_EXCEEDED, e.kind());
            assertEquals(0, reporter.started.get());
        }

        @Test
        @DisplayName("A window the curve cannot cover aborts the whole batch")
        void windowAbortsBatch() {
            for (int workers : new int[] {1, 2}) {
                CalibrationRequest r =
                        request().options(TestCurves.window(6000, 3400)).workers(workers).build();
                CalibrationException e =
                        assertThrows(CalibrationException.class, () -> BatchCalibrator.calibrate(r));
                assertEquals(ErrorKind.DATE_OUT_OF_CALIBRATION_RANGE, e.kind());
            }
        }

        @Test
        @DisplayName("A date failing on a worker is rethrown with its own error kind")
        void workerFailureSurfaces() {
            CountingReporter reporter = new CountingReporter();
            CalibrationRequest r =
                    CalibrationRequest.builder(
                                    new double[] {3000, 3100, 3200, 3300},
                                    new double[] {30, 30, 30, 30})
                            .curves(CurveSelection.perDate("normal", "normal", "intcal13", "normal"))
                            .options(TestCurves.window(20000, 0))
                            .workers(4)
                            .reporter(reporter)
                            .build();

            CalibrationException e =
                    assertThrows(CalibrationException.class, () -> BatchCalibrator.calibrate(r));
            assertEquals(ErrorKind.DATE_OUT_OF_CALIBRATION_RANGE, e.kind());
            assertTrue(e.getMessage().contains("intcal13"), e.getMessage());
            assertTrue(reporter.ids.containsAll(Set.of("1", "2")));
            for (String name : reporter.threads) {
                assertTrue(name.startsWith("calibrate-worker-"), "calibrated on " + name);
            }
            assertEquals(0, reporter.finished.get());
        }

        @Test
        @DisplayName("Non-positive worker counts fall back to one worker")
        void badWorkers() {
            CalDates dates = BatchCalibrator.calibrate(request().workers(0).build());
            assertEquals(3, dates.size());
        }

        private void assertKind(ErrorKind kind, CalibrationRequest.Builder builder) {
            CalibrationRequest r = builder.build();
            CalibrationException e =
                    assertThrows(CalibrationException.class, () -> BatchCalibrator.calibrate(r));
            assertEquals(kind, e.kind());
        }
    }

    private static final class CountingReporter implements ProgressReporter {
        final AtomicInteger started = new AtomicInteger();
        final AtomicInteger finished = new AtomicInteger();
        final Set<String> ids = ConcurrentHashMap.newKeySet();
        final Set<String> threads = ConcurrentHashMap.newKeySet();

        @Override
        public void started(int totalDates) {
            started.addAndGet(totalDates);
        }

        @Override
        public void dateCalibrated(int index, String dateId) {
            ids.add(dateId);
            threads.add(Thread.currentThread().getName());
        }

        @Override
        public void finished(int totalDates) {
            finished.incrementAndGet();
        }
    }
}
