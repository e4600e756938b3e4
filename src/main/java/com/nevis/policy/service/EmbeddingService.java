package com.nevis.policy.service;

import java.util.List;

public interface EmbeddingService {

    List<float[]> embedBatch(List<String> texts);

    float[] embedQuery(String query);
}
