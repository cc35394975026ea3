/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.mwm.commands.series;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.regex.Pattern;

/// Reads a numeric series from text.
///
/// Values are decimal numbers separated by whitespace, commas or newlines.
/// Blank lines are skipped and everything after a `#` on a line is a comment.
/// Any other token, or a value that is not finite, is reported with its line
/// number as a [SeriesFormatException].
public final class SeriesReader {

    private static final Logger logger = LogManager.getLogger(SeriesReader.class);
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    private SeriesReader() {
    }

    /// Reads a series from a UTF-8 file.
    ///
    /// @param path the file to read
    /// @return the values in file order
    /// @throws IOException if the file cannot be read or is malformed
    public static double[] read(Path path) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            double[] series = read(reader);
            logger.debug("Read {} values from {}", series.length, path);
            return series;
        }
    }

    /// Reads a series from a character stream. The reader is not closed.
    ///
    /// @param source the text to parse
    /// @return the values in input order
    /// @throws IOException if reading fails or the text is malformed
    public static double[] read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);
        double[] values = new double[64];
        int count = 0;
        int lineNumber = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            int comment = line.indexOf('#');
            String content = (comment >= 0 ? line.substring(0, comment) : line).trim();
            if (content.isEmpty()) {
                continue;
            }
            for (String token : SEPARATORS.split(content)) {
                if (token.isEmpty()) {
                    continue;
                }
                double value = parse(token, lineNumber);
                if (count == values.length) {
                    values = Arrays.copyOf(values, count * 2);
                }
                values[count++] = value;
            }
        }
        return Arrays.copyOf(values, count);
    }

    private static double parse(String token, int lineNumber) throws SeriesFormatException {
        double value;
        try {
            value = Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new SeriesFormatException(lineNumber, "not a number: '" + token + "'");
        }
        if (!Double.isFinite(value)) {
            throw new SeriesFormatException(lineNumber, "value is not finite: '" + token + "'");
        }
        return value;
    }
}
