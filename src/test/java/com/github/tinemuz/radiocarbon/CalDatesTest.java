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

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CalDatesTest {

    private CalDates sparse;
    private CalDates dense;

    @BeforeEach
    void calibrate() {
        CalibrationRequest.Builder b =
                CalibrationRequest.builder(new double[] {3700, 4000, 4300}, new double[] {30, 30, 30})
                        .ids("p", "q", "r")
                        .curve(TestCurves.identity(20))
                        .options(TestCurves.window(4600, 3400));
        sparse = BatchCalibrator.calibrate(b.storage(StorageMode.SPARSE).build());
        dense = BatchCalibrator.calibrate(b.storage(StorageMode.DENSE).build());
    }

    @Test
    @DisplayName("Exactly one storage form is available")
    void oneStorageMode() {
        assertEquals(3, sparse.grids().size());
        assertThrows(IllegalStateException.class, () -> sparse.matrix());
        assertEquals(3, dense.matrix().columns());
        assertThrows(IllegalStateException.class, () -> dense.grids());
    }

    @Test
    @DisplayName("Dense columns read back as the same grids as sparse storage")
    void gridViewOfDense() {
        for (int i = 0; i < 3; i++) {
            CalGrid s = sparse.grid(i);
            CalGrid d = dense.grid(i);
            assertArrayEquals(s.calBP(), d.calBP());
            assertArrayEquals(s.density(), d.density());
        }
    }

    @Test
    @DisplayName("Subsetting by position keeps the requested order")
    void subsetByIndex() {
        CalDates sub = sparse.subset(2, 0);

        assertEquals(2, sub.size());
        assertEquals("r", sub.record(0).dateId());
        assertEquals("p", sub.record(1).dateId());
        assertEquals(List.of("r", "p"), List.copyOf(sub.grids().keySet()));
        assertSame(sparse.grid("r"), sub.grid("r"));
    }

    @Test
    @DisplayName("Subsetting a dense store slices matrix columns")
    void subsetDense() {
        CalDates sub = dense.subset("q", "r");

        assertEquals(StorageMode.DENSE, sub.storageMode());
        assertEquals(2, sub.matrix().columns());
        assertArrayEquals(dense.matrix().column(1), sub.matrix().column(0));
        assertArrayEquals(dense.matrix().column(2), sub.matrix().column(1));
        assertEquals(1, sub.indexOf("r"));
        assertEquals(-1, sub.indexOf("p"));
    }

    @Test
    @DisplayName("Boolean masks select matching dates")
    void subsetByMask() {
        CalDates sub = dense.subset(new boolean[] {true, false, true});

        assertEquals(2, sub.size());
        assertEquals("p", sub.record(0).dateId());
        assertEquals("r", sub.record(1).dateId());
        assertThrows(IllegalArgumentException.class, () -> dense.subset(new boolean[] {true}));
    }

    @Test
    @DisplayName("Bad selections fail")
    void badSelections() {
        assertThrows(IllegalArgumentException.class, () -> sparse.subset("zzz"));
        assertThrows(IndexOutOfBoundsException.class, () -> sparse.subset(5));
        CalDates empty = sparse.subset(new int[0]);
        assertTrue(empty.isEmpty());
        assertThrows(IllegalStateException.class, () -> empty.subset(0));
    }

    @Test
    @DisplayName("Metadata and grids must line up")
    void mismatchedConstruction() {
        List<DateRecord> meta = sparse.metadata();
        assertThrows(
                IllegalArgumentException.class,
                () -> CalDates.sparse(meta, List.of(sparse.grid(0))));
        assertThrows(
                IllegalArgumentException.class,
                () -> CalDates.dense(meta, new CalMatrix(new TimeRange(10, 0), 2)));
    }
}
