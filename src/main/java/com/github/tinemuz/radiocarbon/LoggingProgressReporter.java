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

import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes batch progress to the log: start and end at info, each date at debug, and
 * an info line every {@code step} dates.
 */
public final class LoggingProgressReporter implements ProgressReporter {
    private static final Logger log = LoggerFactory.getLogger(LoggingProgressReporter.class);

    private final int step;
    private final AtomicInteger done = new AtomicInteger();

    public LoggingProgressReporter() {
        this(100);
    }

    public LoggingProgressReporter(int step) {
        if (step < 1) throw new IllegalArgumentException("step must be positive: " + step);
        this.step = step;
    }

    @Override
    public void started(int totalDates) {
        done.set(0);
        log.info("Calibrating {} radiocarbon ages...", totalDates);
    }

    @Override
    public void dateCalibrated(int index, String dateId) {
        int n = done.incrementAndGet();
        log.debug("Calibrated date {} (#{})", dateId, index);
        if (n % step == 0) {
            log.info("{} dates calibrated", n);
        }
    }

    @Override
    public void finished(int totalDates) {
        log.info("Done: {} dates calibrated", totalDates);
    }

    /** Dates reported since the last {@link #started}. */
    public int completed() {
        return done.get();
    }
}
