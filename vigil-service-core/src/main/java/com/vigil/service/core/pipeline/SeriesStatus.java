package com.vigil.service.core.pipeline;

public enum SeriesStatus {
    OK,
    INSUFFICIENT_DATA,
    COMPUTATION_ERROR,
    TIMED_OUT
}
