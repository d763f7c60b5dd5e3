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

import io.roitools.equity.ConstructionException;
import io.roitools.equity.stats.NanStats;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders grouped observations as text, one line per group.
 *
 * <p>Each line holds the padded group label, a bar sparkline of the group's
 * distribution, the observed count and the mean. All sparklines share one range,
 * the finite range of every group together, so bars line up across groups.
 *
 * <pre>
 * female  ▂▅█▆▃▁      n=412  mean=38211.20
 * male    ▁▂▄▆█▇▄▂▁   n=398  mean=45930.75
 * </pre>
 */
public class SparklineGroupRenderer implements GroupChartRenderer<String> {

    private final int width;

    public SparklineGroupRenderer() {
        this(Sparkline.DEFAULT_WIDTH);
    }

    /**
     * @param width sparkline width in characters
     */
    public SparklineGroupRenderer(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive, was " + width);
        }
        this.width = width;
    }

    @Override
    public String render(List<String> groups, List<double[]> groupedValues) {
        Objects.requireNonNull(groups, "groups cannot be null");
        Objects.requireNonNull(groupedValues, "groupedValues cannot be null");
        if (groups.size() != groupedValues.size()) {
            throw new ConstructionException("groups and grouped values must have the same length: " +
                groups.size() + " vs " + groupedValues.size());
        }

        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int labelWidth = 1;
        for (int i = 0; i < groups.size(); i++) {
            labelWidth = Math.max(labelWidth, groups.get(i).length());
            for (double v : groupedValues.get(i)) {
                if (Double.isFinite(v)) {
                    min = Math.min(min, v);
                    max = Math.max(max, v);
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < groups.size(); i++) {
            double[] values = groupedValues.get(i);
            sb.append(String.format("%-" + labelWidth + "s  ", groups.get(i)));
            sb.append(Sparkline.bars(values, width, min, max));
            sb.append(String.format(Locale.ROOT, "  n=%d  mean=%.2f",
                NanStats.count(values), NanStats.mean(values)));
            sb.append('\n');
        }
        return sb.toString();
    }

    public int width() {
        return width;
    }
}
