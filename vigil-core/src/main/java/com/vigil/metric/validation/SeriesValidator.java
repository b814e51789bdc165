package com.vigil.metric.validation;

import com.vigil.metric.model.MetricSeries;
import java.util.List;

/**
 * Validates submitted metric series before any detection work starts.
 */
public interface SeriesValidator {

    /**
     * Validate a single series.
     *
     * @param series the series to validate
     * @throws IllegalArgumentException if validation fails
     */
    void validate(MetricSeries series);

    /**
     * Validate every series of a batch.
     *
     * @param batch the series to validate
     * @throws IllegalArgumentException naming the offending position if any series fails validation
     */
    default void validateAll(List<MetricSeries> batch) {
        if (batch == null || batch.isEmpty()) {
            throw new IllegalArgumentException("series list must not be empty");
        }
        for (int i = 0; i < batch.size(); i++) {
            MetricSeries series = batch.get(i);
            if (series == null) {
                throw new IllegalArgumentException(String.format("Invalid series[%d]: series is null", i));
            }
            try {
                validate(series);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(String.format("Invalid series[%d]: %s", i, e.getMessage()), e);
            }
        }
    }
}
