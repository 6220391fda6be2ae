package com.breachwatch.monitor.api;

public record ApiErrorResponse(String code, String message) {}
