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
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access to the built-in calibration curves.
 *
 * <p>Curves are looked up by name. The published tables are read from the classpath
 * resource <code>curves/&lt;name&gt;.14c</code>, or from a directory named by the
 * system property {@value #CURVE_DIR_PROPERTY} when that is set. The
 * <code>normal</code> curve (no calibration: radiocarbon age equals calendar age,
 * zero error) is generated in memory. Each curve is read once and cached.</p>
 *
 * <p>The published tables are not packaged with this library. Every name other than
 * {@value #NORMAL} needs its <code>&lt;name&gt;.14c</code> file supplied by the
 * application, either on its classpath under <code>curves/</code> or in the
 * {@value #CURVE_DIR_PROPERTY} directory; loading a curve whose file is absent
 * throws {@link IllegalStateException}. This also applies to the default curve of a
 * {@link CalibrationRequest} and to {@link CurveMixer#mix(String, double, double, double)}.</p>
 */
public final class CalibrationCurves {
    private static final Logger log = LoggerFactory.getLogger(CalibrationCurves.class);

    /** System property naming a directory searched before the classpath. */
    public static final String CURVE_DIR_PROPERTY = "radiocarbon.curves.dir";

    public static final String INTCAL13 = "intcal13";
    public static final String SHCAL13 = "shcal13";
    public static final String MARINE13 = "marine13";
    public static final String INTCAL13_NH_PINE16 = "intcal13nhpine16";
    public static final String SHCAL13_SH_KAURI16 = "shcal13shkauri16";
    public static final String NORMAL = "normal";

    /** Label recorded for dates calibrated against a caller-supplied table. */
    public static final String CUSTOM = "custom";

    private static final Set<String> KNOWN =
            Collections.unmodifiableSet(
                    new LinkedHashSet<>(
                            List.of(
                                    INTCAL13,
                                    SHCAL13,
                                    MARINE13,
                                    INTCAL13_NH_PINE16,
                                    SHCAL13_SH_KAURI16,
                                    NORMAL)));

    private static final int NORMAL_MAX_BP = 50000;

    private static final Map<String, CalibrationCurve> CACHE = new ConcurrentHashMap<>();

    private CalibrationCurves() {}

    /** Names accepted by {@link #load(String)}. */
    public static Set<String> knownNames() {
        return KNOWN;
    }

    public static boolean isKnown(String name) {
        return name != null && KNOWN.contains(name);
    }

    /**
     * Load a built-in curve by name.
     *
     * @throws CalibrationException with {@link ErrorKind#UNKNOWN_CURVE_NAME} for names
     *     outside {@link #knownNames()}, or {@link ErrorKind#INVALID_CURVE_FORMAT} when the
     *     curve file has malformed rows
     * @throws IllegalStateException if the curve file cannot be found or read
     */
    public static CalibrationCurve load(String name) {
        if (!isKnown(name)) {
            throw new CalibrationException(
                    ErrorKind.UNKNOWN_CURVE_NAME,
                    "Unknown calibration curve '" + name + "'; expected one of " + KNOWN
                            + " or a custom three-column table");
        }
        return CACHE.computeIfAbsent(name, CalibrationCurves::read);
    }

    /**
     * Wrap a caller-supplied three-column table (calendar age BP, radiocarbon age BP,
     * error) as a curve labelled {@value #CUSTOM}.
     */
    public static CalibrationCurve custom(double[][] table) {
        return CalibrationCurve.of(CUSTOM, table);
    }

    /**
     * Parse the text form of a curve: lines containing '#' are comments, remaining
     * lines hold comma or whitespace separated columns of which the first three are
     * used.
     *
     * @throws IOException if reading fails
     * @throws CalibrationException with {@link ErrorKind#INVALID_CURVE_FORMAT} for rows
     *     with fewer than three numeric columns
     */
    public static CalibrationCurve parse(String name, BufferedReader reader) throws IOException {
        List<double[]> rows = new ArrayList<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            line = line.trim();
            if (line.isEmpty() || line.contains("#")) continue; // skip blanks/comments
            String[] toks = line.split("[,\\s]+");
            if (toks.length < 3) {
                throw new CalibrationException(
                        ErrorKind.INVALID_CURVE_FORMAT,
                        "Curve '" + name + "' line " + lineNo + " has fewer than three columns");
            }
            double[] row = new double[3];
            for (int i = 0; i < 3; i++) {
                try {
                    row[i] = Double.parseDouble(toks[i]);
                } catch (NumberFormatException e) {
                    throw new CalibrationException(
                            ErrorKind.INVALID_CURVE_FORMAT,
                            "Curve '" + name + "' line " + lineNo + " is not numeric: " + line,
                            e);
                }
            }
            rows.add(row);
        }
        return CalibrationCurve.of(name, rows.toArray(new double[0][]));
    }

    private static CalibrationCurve read(String name) {
        if (NORMAL.equals(name)) {
            return normalCurve();
        }
        String file = name + ".14c";
        try (InputStream in = open(file)) {
            if (in == null) {
                log.error("Calibration curve file '{}' not found on classpath", file);
                throw new IllegalStateException(
                        "Calibration curve file 'curves/" + file + "' not found on classpath"
                                + " or in -D" + CURVE_DIR_PROPERTY
                                + "; published curve tables must be supplied by the application");
            }
            try (BufferedReader br =
                    new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                CalibrationCurve curve = parse(name, br);
                log.debug("Loaded calibration curve {} ({} rows)", name, curve.size());
                return curve;
            }
        } catch (IOException e) {
            log.error("Failed to read calibration curve file '{}'", file, e);
            throw new IllegalStateException("Failed to read calibration curve file " + file, e);
        }
    }

    private static InputStream open(String file) throws IOException {
        String dir = System.getProperty(CURVE_DIR_PROPERTY);
        if (dir != null && !dir.isBlank()) {
            Path path = Paths.get(dir, file);
            if (Files.isRegularFile(path)) {
                return Files.newInputStream(path);
            }
            log.debug("{} not found in {}, falling back to classpath", file, dir);
        }
        return CalibrationCurves.class.getClassLoader().getResourceAsStream("curves/" + file);
    }

    private static CalibrationCurve normalCurve() {
        double[][] table = new double[NORMAL_MAX_BP + 1][];
        for (int y = 0; y <= NORMAL_MAX_BP; y++) {
            table[y] = new double[] {y, y, 0.0};
        }
        return CalibrationCurve.of(NORMAL, table);
    }
}
