package com.asl.search.completion;

public class CompletionOptions {
    private final double temperature;
    private final Integer timeoutMs;

    public CompletionOptions(double temperature, Integer timeoutMs) {
        this.temperature = temperature;
        this.timeoutMs = timeoutMs;
    }

    public static CompletionOptions withTemperature(double temperature) {
        return new CompletionOptions(temperature, null);
    }

    public double getTemperature() {
        return temperature;
    }

    public Integer getTimeoutMs() {
        return timeoutMs;
    }
}
