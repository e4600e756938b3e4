package com.nevis.policy.controller;

import com.nevis.policy.model.PolicyCategory;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreatePolicyRequest(
    @NotBlank
    @Size(max = 100)
    String source,

    @NotBlank
    String title,

    String description,

    @NotNull
    PolicyCategory category
) {}
