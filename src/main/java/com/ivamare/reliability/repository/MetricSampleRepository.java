package com.ivamare.reliability.repository;

import com.ivamare.reliability.metrics.MetricSample;

import java.time.Instant;
import java.util.List;

/**
 * Durable store for metric samples.
 */
public interface MetricSampleRepository {

    /**
     * Store one sample.
     *
     * @param sample the sample
     */
    void save(MetricSample sample);

    /**
     * Samples for one key ({@code category.name}) in a time range, oldest first.
     *
     * @param category Metric category
     * @param name Metric name
     * @param from Inclusive lower bound
     * @param to Inclusive upper bound
     * @return samples in time order
     */
    List<MetricSample> find(String category, String name, Instant from, Instant to);
}
