package com.nevis.policy.event;

import com.nevis.policy.model.RevisionDeletion;

public record RevisionDeletedEvent(RevisionDeletion deletion) {}
