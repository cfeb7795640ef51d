package com.asl.search.audit;

public interface RequestLogSink {
    void record(RequestSummary summary);
}
