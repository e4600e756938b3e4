package com.nevis.policy.ingest;

import com.nevis.policy.model.IngestionPhase;

public interface IngestionListener {

    IngestionListener NO_OP = new IngestionListener() {
        @Override
        public void onPhase(IngestionPhase phase) {
        }

        @Override
        public void onProgress(int processed, int total) {
        }
    };

    void onPhase(IngestionPhase phase);

    void onProgress(int processed, int total);
}
