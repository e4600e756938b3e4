package com.nevis.policy.model;

import java.util.List;

public record DocumentDetail(
    PolicyDocument document,
    List<PolicyRevision> revisions,
    PolicyRevision currentRevision
) {}
