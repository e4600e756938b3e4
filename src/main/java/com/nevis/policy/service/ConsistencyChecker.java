package com.nevis.policy.service;

import com.nevis.policy.model.ConsistencyReport;

public interface ConsistencyChecker {

    ConsistencyReport check();
}
