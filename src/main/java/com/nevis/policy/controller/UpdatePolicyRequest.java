package com.nevis.policy.controller;

import com.nevis.policy.model.PolicyCategory;
import jakarta.validation.constraints.Size;

public record UpdatePolicyRequest(
    @Size(min = 1)
    String title,

    String description,

    PolicyCategory category
) {}
