package io.roitools.equity.stats;

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

import java.util.Arrays;
import java.util.Objects;

/**
 * NaN-tolerant reductions over {@code double[]} observations.
 *
 * <p>Every reduction here skips {@code NaN} entries, which act as the missing-value
 * marker throughout the equity package. Variances use the population formula
 * (divide by N). An array with no observed values yields {@code NaN} from the
 * value reductions and {@code 0} from {@link #count(double[])}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * double[] wages = {31000.0, Double.NaN, 45000.0, 52000.0};
 * double mean = NanStats.mean(wages);              // 42666.67
 * double var = NanStats.populationVariance(wages); // divides by 3
 * }</pre>
 */
public final class NanStats {

    private NanStats() {}

    /**
     * Returns the number of non-NaN entries.
     */
    public static int count(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        int count = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) count++;
        }
        return count;
    }

    /**
     * Returns the number of NaN entries.
     */
    public static int nanCount(double[] values) {
        return values.length - count(values);
    }

    /**
     * Returns the sum of non-NaN entries, {@code 0} when there are none.
     */
    public static double sum(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        double sum = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) sum += v;
        }
        return sum;
    }

    /**
     * Returns the sum of the absolute values of non-NaN entries.
     */
    public static double sumAbsolute(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        double sum = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) sum += Math.abs(v);
        }
        return sum;
    }

    /**
     * Returns the arithmetic mean of non-NaN entries.
     */
    public static double mean(double[] values) {
        int count = count(values);
        if (count == 0) {
            return Double.NaN;
        }
        return sum(values) / count;
    }

    /**
     * Returns the population variance of non-NaN entries, computed in two passes
     * around the mean.
     */
    public static double populationVariance(double[] values) {
        int count = count(values);
        if (count == 0) {
            return Double.NaN;
        }
        double mean = sum(values) / count;
        double m2 = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                double diff = v - mean;
                m2 += diff * diff;
            }
        }
        return m2 / count;
    }

    /**
     * Returns the population standard deviation of non-NaN entries.
     */
    public static double populationStdDev(double[] values) {
        return Math.sqrt(populationVariance(values));
    }

    /**
     * Returns the smallest non-NaN entry.
     */
    public static double min(double[] values) {
        double min = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v) && (Double.isNaN(min) || v < min)) min = v;
        }
        return min;
    }

    /**
     * Returns the largest non-NaN entry.
     */
    public static double max(double[] values) {
        double max = Double.NaN;
        for (double v : values) {
            if (!Double.isNaN(v) && (Double.isNaN(max) || v > max)) max = v;
        }
        return max;
    }

    /**
     * Returns the median of non-NaN entries, averaging the two middle values for
     * an even count.
     */
    public static double median(double[] values) {
        double[] sorted = sortedObserved(values);
        int n = sorted.length;
        if (n == 0) {
            return Double.NaN;
        }
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    /**
     * Returns the number of non-NaN entries that are zero or negative.
     */
    public static int countNonPositive(double[] values) {
        int count = 0;
        for (double v : values) {
            if (v <= 0) count++;
        }
        return count;
    }

    /**
     * Returns the number of non-NaN entries that are strictly negative.
     */
    public static int countNegative(double[] values) {
        int count = 0;
        for (double v : values) {
            if (v < 0) count++;
        }
        return count;
    }

    /**
     * Returns a new array holding only the non-NaN entries, in their original order.
     */
    public static double[] observed(double[] values) {
        Objects.requireNonNull(values, "values cannot be null");
        double[] out = new double[count(values)];
        int i = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) out[i++] = v;
        }
        return out;
    }

    /**
     * Returns a new ascending array of the non-NaN entries.
     */
    public static double[] sortedObserved(double[] values) {
        double[] out = observed(values);
        Arrays.sort(out);
        return out;
    }
}
