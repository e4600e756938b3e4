package com.nevis.policy.worker;

import com.nevis.policy.service.PolicyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class RevisionIndexWarmup {

    private final PolicyRegistry registry;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        registry.rebuildIndex();
    }
}
