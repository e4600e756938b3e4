package com.nevis.policy.model;

public record DocumentUpdate(
    String title,
    String description,
    PolicyCategory category
) {}
