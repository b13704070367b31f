package com.tony.baseballAnalytics.exception;

public class StatsNotFoundException extends RuntimeException {

    public StatsNotFoundException(String message) {
        super(message);
    }
}
