package com.nevis.policy.ingest;

public record PageText(int pageNumber, String text) {}
