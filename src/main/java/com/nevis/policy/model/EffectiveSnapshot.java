package com.nevis.policy.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

public record EffectiveSnapshot(
    LocalDate date,
    Map<String, Resolution> resolutions,
    List<String> inForce,
    List<String> notYetEffective,
    List<String> inGap,
    List<String> withoutRevisions
) {}
