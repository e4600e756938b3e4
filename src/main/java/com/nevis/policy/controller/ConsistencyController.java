package com.nevis.policy.controller;

import com.nevis.policy.model.ConsistencyReport;
import com.nevis.policy.service.ConsistencyChecker;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ConsistencyController {

    private final ConsistencyChecker consistencyChecker;

    @GetMapping("/admin/consistency")
    public ResponseEntity<ConsistencyReport> check() {
        return ResponseEntity.ok(consistencyChecker.check());
    }
}
