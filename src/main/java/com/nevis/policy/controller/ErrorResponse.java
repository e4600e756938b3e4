package com.nevis.policy.controller;

public record ErrorResponse(
    String message,
    String errorCode,
    int status,
    long timestamp
) {}
