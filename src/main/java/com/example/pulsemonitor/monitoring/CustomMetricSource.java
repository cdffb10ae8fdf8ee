package com.example.pulsemonitor.monitoring;

/**
 * Producer of one application-defined metric value. Called off the sampling
 * thread; a failure only zeroes this metric.
 */
@FunctionalInterface
public interface CustomMetricSource {

    double read() throws Exception;
}
