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
package com.github.tinemuz.moon;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the whitespace separated data tables shipped on the classpath.
 *
 * <p>Each data row starts with an ISO calendar date ({@code yyyy-MM-dd}, midnight UTC) followed by a numeric
 * value. Blank lines and lines starting with {@code #} are skipped. Rows are returned as parsed
 * {@code (julianDay, value)} pairs in file order.</p>
 */
final class TableResources {
    private static final Logger log = LoggerFactory.getLogger(TableResources.class);

    private TableResources() {}

    /**
     * Load a dated table from the classpath. Any problem reading or parsing the file is logged and rethrown as an
     * IllegalStateException.
     */
    static List<double[]> readDatedRows(String resourceName) {
        InputStream in = TableResources.class.getClassLoader().getResourceAsStream(resourceName);
        if (in == null) {
            log.error("Table '{}' not found on classpath", resourceName);
            throw new IllegalStateException("Table '" + resourceName + "' not found on classpath");
        }
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<double[]> rows = new ArrayList<>();
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                line = line.trim();
                if (line.isEmpty() || line.startsWith("#")) continue; // skip blanks/comments
                String[] toks = line.split("\\s+");
                if (toks.length < 2) {
                    throw new IllegalStateException("Malformed row " + lineNo + " in " + resourceName + ": " + line);
                }
                rows.add(new double[] {parseDate(toks[0]), Double.parseDouble(toks[1])});
            }
            if (rows.isEmpty()) {
                throw new IllegalStateException("Table '" + resourceName + "' has no data rows");
            }
            log.debug("Read {} rows from {}", rows.size(), resourceName);
            return rows;
        } catch (IOException e) {
            log.error("Failed to read table {}", resourceName, e);
            throw new IllegalStateException("Failed to read table " + resourceName, e);
        } catch (RuntimeException e) {
            log.error("Failed to parse table {}", resourceName, e);
            throw new IllegalStateException("Failed to parse table " + resourceName, e);
        }
    }

    private static double parseDate(String token) {
        String[] parts = token.split("-");
        if (parts.length != 3) {
            throw new IllegalStateException("Expected yyyy-MM-dd but got '" + token + "'");
        }
        return TimeSystemConverter.julianDay(
                Integer.parseInt(parts[0]), Integer.parseInt(parts[1]), Double.parseDouble(parts[2]));
    }
}
