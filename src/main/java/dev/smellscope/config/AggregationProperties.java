package dev.smellscope.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * overlapThreshold: two same-category findings merge when the share of the
 * shorter range they have in common is strictly greater than this. 0.0 merges
 * on any shared line.
 */
@ConfigurationProperties(prefix = "smellscope.aggregation")
public record AggregationProperties(double overlapThreshold, String categoryTable) {
    public AggregationProperties {
        if (Double.isNaN(overlapThreshold) || overlapThreshold < 0.0 || overlapThreshold >= 1.0)
            throw new IllegalArgumentException("overlap-threshold must be within [0,1)");
        if (categoryTable == null || categoryTable.isBlank()) categoryTable = "classpath:smell-categories.json";
    }

    public static AggregationProperties defaults() {
        return new AggregationProperties(0.0, null);
    }
}
