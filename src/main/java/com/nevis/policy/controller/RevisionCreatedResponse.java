package com.nevis.policy.controller;

import com.nevis.policy.model.RevisionCreation;
import com.nevis.policy.model.Supersession;

public record RevisionCreatedResponse(
    RevisionResponse revision,
    Supersession supersession
) {

    public static RevisionCreatedResponse from(RevisionCreation creation) {
        return new RevisionCreatedResponse(RevisionResponse.from(creation.revision()), creation.supersession());
    }
}
