package io.roitools.charts;

/*
 * Copyright (c) roitools
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

/**
 * Generates Unicode bar sparklines of value distributions.
 *
 * <h2>Block Characters</h2>
 * <pre>
 * ▁ U+2581 LOWER ONE EIGHTH BLOCK
 * ▂ U+2582 LOWER ONE QUARTER BLOCK
 * ▃ U+2583 LOWER THREE EIGHTHS BLOCK
 * ▄ U+2584 LOWER HALF BLOCK
 * ▅ U+2585 LOWER FIVE EIGHTHS BLOCK
 * ▆ U+2586 LOWER THREE QUARTERS BLOCK
 * ▇ U+2587 LOWER SEVEN EIGHTHS BLOCK
 * █ U+2588 FULL BLOCK
 * </pre>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * double[] wages = ...;
 *
 * // Histogram over the data's own range
 * String bars = Sparkline.bars(wages, 12);
 * // Output: "▁▂▄▇█▇▄▂▁▁▁▁"
 *
 * // Histogram over a fixed range, so several groups line up
 * String aligned = Sparkline.bars(wages, 12, 0.0, 200_000.0);
 * }</pre>
 */
public final class Sparkline {

    /** Unicode block characters from lowest to highest */
    private static final char[] BLOCKS = {
        ' ',      // 0/8 - empty (for zero counts)
        '\u2581', // 1/8 ▁
        '\u2582', // 2/8 ▂
        '\u2583', // 3/8 ▃
        '\u2584', // 4/8 ▄
        '\u2585', // 5/8 ▅
        '\u2586', // 6/8 ▆
        '\u2587', // 7/8 ▇
        '\u2588'  // 8/8 █
    };

    /** Default sparkline width */
    public static final int DEFAULT_WIDTH = 12;

    private Sparkline() {}

    /**
     * Generates a histogram sparkline over the finite range of the data.
     *
     * @param data the values; NaN and infinite entries are skipped
     * @param width number of bins/characters in the sparkline
     * @return Unicode sparkline string of exactly {@code width} characters
     */
    public static String bars(double[] data, int width) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        if (data != null) {
            for (double v : data) {
                if (Double.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }
        return bars(data, width, min, max);
    }

    /**
     * Generates a histogram sparkline over a fixed range. Values outside the range
     * are clamped into the first or last bin.
     *
     * @param data the values; NaN and infinite entries are skipped
     * @param width number of bins/characters in the sparkline
     * @param min lower edge of the first bin
     * @param max upper edge of the last bin
     * @return Unicode sparkline string of exactly {@code width} characters
     */
    public static String bars(double[] data, int width, double min, double max) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive, was " + width);
        }
        if (data == null || !Double.isFinite(min) || !Double.isFinite(max)) {
            return " ".repeat(width);
        }

        int[] bins = new int[width];
        int counted = 0;
        double range = max - min;
        for (double v : data) {
            if (!Double.isFinite(v)) {
                continue;
            }
            int bin;
            if (range <= 0) {
                bin = width / 2;
            } else {
                bin = (int) ((v - min) / range * width);
                if (bin >= width) bin = width - 1; // Handle max value
                if (bin < 0) bin = 0;
            }
            bins[bin]++;
            counted++;
        }
        if (counted == 0) {
            return " ".repeat(width);
        }

        // Find max bin count for normalization
        int maxCount = 0;
        for (int count : bins) {
            maxCount = Math.max(maxCount, count);
        }

        StringBuilder sb = new StringBuilder(width);
        for (int count : bins) {
            int level = count * 8 / maxCount;
            if (count > 0 && level == 0) {
                level = 1;
            }
            sb.append(BLOCKS[level]);
        }
        return sb.toString();
    }
}
