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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calibrates many radiocarbon dates into a {@link CalDates} store.
 *
 * <p>The whole request is validated before any date is calibrated. Each date is then
 * calibrated independently by {@link ForwardCalibrator}, optionally on several worker
 * threads; results go to fixed slots (grid position or matrix column), so completion
 * order does not matter. If any date fails the batch is abandoned and the failure is
 * rethrown.</p>
 */
public final class BatchCalibrator {
    private static final Logger log = LoggerFactory.getLogger(BatchCalibrator.class);

    private BatchCalibrator() {}

    /**
     * Calibrate every date of the request.
     *
     * @throws CalibrationException for invalid input (see {@link ErrorKind}) or when a
     *     date cannot be calibrated over the requested window
     */
    public static CalDates calibrate(CalibrationRequest request) {
        int n = request.size();
        double[] ages = request.ages();
        double[] errors = request.errors();
        validateMeasurements(ages, errors);
        String[] ids = resolveIds(request.ids(), n);
        Object[] details = request.details();
        if (details != null && details.length != n) {
            throw lengthMismatch("details", details.length, n);
        }
        double[] offsets = expand(request.reservoirOffsets(), n, "reservoir offsets");
        double[] offsetErrors =
                expand(request.reservoirOffsetErrors(), n, "reservoir offset errors");
        CalibrationCurve[] curves = request.curves().resolve(n);
        for (int i = 0; i < n; i++) {
            curves[i].requireRadiocarbonAge(ages[i] - offsets[i]);
        }

        CalibrationOptions options = request.options();
        StorageMode storage = request.storage();
        int workers = effectiveWorkers(request.workers());
        ProgressReporter reporter = request.reporter();
        log.debug("Calibrating {} dates on {} worker(s), storage {}", n, workers, storage);

        CalMatrix matrix = storage == StorageMode.DENSE ? new CalMatrix(options.timeRange(), n) : null;
        CalGrid[] grids = new CalGrid[n];
        reporter.started(n);
        DateTask task =
                b -> {
                    CalGrid grid =
                            ForwardCalibrator.calibrate(
                                    ages[b], errors[b], curves[b], offsets[b], offsetErrors[b],
                                    options);
                    if (matrix != null) matrix.scatter(b, grid);
                    else grids[b] = grid;
                    reporter.dateCalibrated(b, ids[b]);
                };
        if (workers == 1 || n < 2) {
            for (int b = 0; b < n; b++) task.run(b);
        } else {
            runParallel(task, n, workers);
        }
        reporter.finished(n);

        List<DateRecord> metadata = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            metadata.add(
                    new DateRecord(
                            ids[i],
                            ages[i],
                            errors[i],
                            details == null ? null : details[i],
                            curves[i].name(),
                            offsets[i],
                            offsetErrors[i],
                            options.timeRange().startBP(),
                            options.timeRange().endBP(),
                            options.normalised(),
                            options.useF14C(),
                            options.eps()));
        }
        return matrix != null
                ? CalDates.dense(metadata, matrix)
                : CalDates.sparse(metadata, Arrays.asList(grids));
    }

    @FunctionalInterface
    private interface DateTask {
        void run(int index);
    }

    private static void runParallel(DateTask task, int n, int workers) {
        ExecutorService pool =
                Executors.newFixedThreadPool(Math.min(workers, n), new WorkerThreadFactory());
        List<Future<?>> futures = new ArrayList<>(n);
        try {
            for (int b = 0; b < n; b++) {
                final int index = b;
                futures.add(pool.submit(() -> task.run(index)));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("Calibration worker failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while calibrating dates", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private static void validateMeasurements(double[] ages, double[] errors) {
        if (ages.length != errors.length) {
            throw new CalibrationException(
                    ErrorKind.INPUT_LENGTH_MISMATCH,
                    "Ages and errors (and ids/details/offsets if provided) must be the same length");
        }
        for (int i = 0; i < ages.length; i++) {
            if (Double.isNaN(ages[i]) || Double.isNaN(errors[i])) {
                throw new CalibrationException(
                        ErrorKind.MISSING_VALUE, "Ages or errors contain NaN (date #" + (i + 1) + ")");
            }
        }
    }

    private static String[] resolveIds(String[] ids, int n) {
        if (ids == null) {
            String[] out = new String[n];
            for (int i = 0; i < n; i++) out[i] = Integer.toString(i + 1);
            return out;
        }
        if (ids.length != n) throw lengthMismatch("ids", ids.length, n);
        Set<String> seen = new HashSet<>();
        for (String id : ids) {
            if (id == null) {
                throw new CalibrationException(ErrorKind.MISSING_VALUE, "Date ids contain null");
            }
            if (!seen.add(id)) {
                throw new CalibrationException(
                        ErrorKind.DUPLICATE_IDENTIFIER,
                        "Date ids must be unique or left as defaults; '" + id + "' repeats");
            }
        }
        return ids.clone();
    }

    private static double[] expand(double[] values, int n, String what) {
        for (double v : values) {
            if (Double.isNaN(v)) {
                throw new CalibrationException(ErrorKind.MISSING_VALUE, what + " contain NaN");
            }
        }
        if (values.length == n) return values.clone();
        if (values.length == 1) {
            double[] out = new double[n];
            Arrays.fill(out, values[0]);
            return out;
        }
        throw lengthMismatch(what, values.length, n);
    }

    private static int effectiveWorkers(int requested) {
        if (requested < 1) {
            log.warn("Worker count {} is not positive; running on 1 worker", requested);
            return 1;
        }
        return requested;
    }

    private static CalibrationException lengthMismatch(String what, int got, int expected) {
        return new CalibrationException(
                ErrorKind.INPUT_LENGTH_MISMATCH,
                "Got " + got + " " + what + " for " + expected + " dates");
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger count = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "calibrate-worker-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
