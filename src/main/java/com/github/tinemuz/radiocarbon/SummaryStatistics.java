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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Per-date summaries of a {@link CalDates} store: highest posterior density (HPD)
 * intervals and median dates. Sparse and dense stores give the same answers.
 */
public final class SummaryStatistics {

    /** Default HPD probabilities: one and two sigma. */
    public static final double[] SIGMA_PROBABILITIES = {0.683, 0.954};

    private SummaryStatistics() {}

    /**
     * HPD intervals of every date at the given credible mass.
     *
     * <p>Densities are sorted in decreasing order and accumulated until they reach
     * {@code credibleMass} of the date's total; every year whose density is at least the
     * last accumulated value belongs to the region. The region is reported as runs of
     * consecutive years, oldest run first.</p>
     *
     * @param credibleMass probability in (0, 1]
     * @return one list of intervals per date, in store order
     */
    public static List<List<HpdInterval>> hpdIntervals(CalDates dates, double credibleMass) {
        if (!(credibleMass > 0 && credibleMass <= 1)) {
            throw new IllegalArgumentException("credibleMass must be in (0, 1]: " + credibleMass);
        }
        List<List<HpdInterval>> out = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            out.add(hpd(dates.grid(i), credibleMass));
        }
        return out;
    }

    /** HPD intervals of a single grid. */
    public static List<HpdInterval> hpd(CalGrid grid, double credibleMass) {
        if (!(credibleMass > 0 && credibleMass <= 1)) {
            throw new IllegalArgumentException("credibleMass must be in (0, 1]: " + credibleMass);
        }
        int n = grid.size();
        double[] sorted = grid.density();
        Arrays.sort(sorted);
        // summed largest first, in the same order as the running sum below
        double total = 0.0;
        for (int i = n - 1; i >= 0; i--) total += sorted[i];
        if (!(total > 0)) return Collections.emptyList();
        double target = total * credibleMass;
        double cumulative = 0.0;
        double height = sorted[0];
        for (int i = n - 1; i >= 0; i--) {
            cumulative += sorted[i];
            if (cumulative >= target) {
                height = sorted[i];
                break;
            }
        }
        if (height <= 0) height = Double.MIN_VALUE;

        List<HpdInterval> runs = new ArrayList<>();
        int start = 0;
        int prev = 0;
        boolean open = false;
        for (int i = 0; i < n; i++) {
            if (grid.densityAt(i) < height) continue;
            int year = grid.yearAt(i);
            if (open && prev - year > 1) {
                runs.add(new HpdInterval(start, prev));
                open = false;
            }
            if (!open) {
                start = year;
                open = true;
            }
            prev = year;
        }
        if (open) runs.add(new HpdInterval(start, prev));
        return runs;
    }

    /**
     * Median calendar year of every date: the year whose cumulative density (summed
     * from the oldest year) is closest to half the date's total. When two years are
     * equally close the one where the cumulative density reaches half wins.
     */
    public static int[] medianDates(CalDates dates) {
        int[] out = new int[dates.size()];
        for (int i = 0; i < dates.size(); i++) {
            out[i] = median(dates.grid(i));
        }
        return out;
    }

    /** Median calendar year of a single grid. */
    public static int median(CalGrid grid) {
        if (grid.isEmpty()) throw new IllegalArgumentException("Empty grid has no median");
        double total = grid.sum();
        double half = total / 2.0;
        double tie = total * 1e-9;
        double cumulative = 0.0;
        double previousDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < grid.size(); i++) {
            cumulative += grid.densityAt(i);
            if (cumulative >= half) {
                double distance = cumulative - half;
                if (i > 0 && previousDistance < distance - tie) {
                    return grid.yearAt(i - 1);
                }
                return grid.yearAt(i);
            }
            previousDistance = half - cumulative;
        }
        return grid.yearAt(grid.size() - 1);
    }

    /**
     * Median and HPD ranges for every date.
     *
     * @param probabilities HPD probabilities; {@link #SIGMA_PROBABILITIES} when null or
     *                      empty, in which case ranges are labelled OneSigma/TwoSigma
     * @param scale         year numbering of the reported values
     */
    public static List<DateSummary> summarise(
            CalDates dates, double[] probabilities, CalendarScale scale) {
        boolean sigmas = probabilities == null || probabilities.length == 0;
        double[] probs = sigmas ? SIGMA_PROBABILITIES : probabilities;
        String[] labels = new String[probs.length];
        List<List<List<HpdInterval>>> perProb = new ArrayList<>(probs.length);
        for (int p = 0; p < probs.length; p++) {
            String base = sigmas ? (p == 0 ? "OneSigma" : "TwoSigma") : "p_" + probs[p];
            labels[p] = base + "_" + scale.name();
            perProb.add(hpdIntervals(dates, probs[p]));
        }
        int[] medians = medianDates(dates);
        List<DateSummary> out = new ArrayList<>(dates.size());
        for (int i = 0; i < dates.size(); i++) {
            Map<String, List<HpdInterval>> ranges = new LinkedHashMap<>();
            for (int p = 0; p < probs.length; p++) {
                ranges.put(labels[p], perProb.get(p).get(i));
            }
            out.add(new DateSummary(dates.record(i).dateId(), medians[i], ranges, scale));
        }
        return out;
    }

    /** {@link #summarise(CalDates, double[], CalendarScale)} with one and two sigma in BP. */
    public static List<DateSummary> summarise(CalDates dates) {
        return summarise(dates, null, CalendarScale.BP);
    }

    /**
     * Summary of one date. Intervals are stored in years BP; {@link #median()} and
     * {@link #formatRanges(String)} report on the summary's scale.
     */
    public static final class DateSummary {
        private final String dateId;
        private final int medianBP;
        private final Map<String, List<HpdInterval>> ranges;
        private final CalendarScale scale;

        DateSummary(
                String dateId,
                int medianBP,
                Map<String, List<HpdInterval>> ranges,
                CalendarScale scale) {
            this.dateId = dateId;
            this.medianBP = medianBP;
            this.ranges = Collections.unmodifiableMap(ranges);
            this.scale = scale;
        }

        public String dateId() {
            return dateId;
        }

        public int medianBP() {
            return medianBP;
        }

        /** Median on the summary's scale. */
        public int median() {
            return scale.fromBP(medianBP);
        }

        public CalendarScale scale() {
            return scale;
        }

        /** HPD intervals in years BP keyed by label, e.g. "OneSigma_BP". */
        public Map<String, List<HpdInterval>> ranges() {
            return ranges;
        }

        /** Ranges under a label as "a to b" strings on the summary's scale. */
        public List<String> formatRanges(String label) {
            List<HpdInterval> list = ranges.get(label);
            if (list == null) throw new IllegalArgumentException("No ranges labelled " + label);
            List<String> out = new ArrayList<>(list.size());
            for (HpdInterval r : list) {
                out.add(scale.fromBP(r.startBP()) + " to " + scale.fromBP(r.endBP()));
            }
            return out;
        }

        @Override
        public String toString() {
            StringJoiner j = new StringJoiner(", ", dateId + " [median " + median() + "; ", "]");
            for (String label : ranges.keySet()) j.add(label + "=" + formatRanges(label));
            return j.toString();
        }
    }
}
