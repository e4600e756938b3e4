package com.nevis.policy.ingest;

import com.nevis.policy.config.IngestionProperties;
import com.nevis.policy.exception.EmbeddingFailedException;
import com.nevis.policy.exception.ExtractionFailedException;
import com.nevis.policy.model.IngestionPhase;
import com.nevis.policy.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class PdfTextProcessingCapability implements TextProcessingCapability {

    private final PdfTextExtractor extractor;
    private final PolicyTextChunker chunker;
    private final EmbeddingService embeddingService;
    private final IngestionProperties properties;

    @Override
    public ProcessedDocument process(byte[] content, IngestionListener listener) {
        listener.onPhase(IngestionPhase.EXTRACTING);
        List<PageText> pages = extractor.extract(content);
        List<TextChunk> chunks = chunker.chunk(pages);
        if (chunks.isEmpty()) {
            throw new ExtractionFailedException("No text could be extracted from %d pages".formatted(pages.size()));
        }
        log.debug("Split {} pages into {} chunks", pages.size(), chunks.size());

        listener.onPhase(IngestionPhase.EMBEDDING);
        int batchSize = properties.embeddingBatchSize();
        List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());

        for (int start = 0; start < chunks.size(); start += batchSize) {
            List<TextChunk> batch = chunks.subList(start, Math.min(start + batchSize, chunks.size()));
            List<float[]> vectors;
            try {
                vectors = embeddingService.embedBatch(batch.stream().map(TextChunk::text).toList());
            } catch (RuntimeException e) {
                throw new EmbeddingFailedException(
                    "Batch starting at chunk %d failed: %s".formatted(start, e.getMessage()), e);
            }

            for (int i = 0; i < batch.size(); i++) {
                TextChunk chunk = batch.get(i);
                embedded.add(new EmbeddedChunk(chunk.chunkIndex(), chunk.text(), chunk.sectionRef(),
                    chunk.pageNumber(), vectors.get(i)));
            }
            listener.onProgress(embedded.size(), chunks.size());
        }

        return new ProcessedDocument(pages.size(), embedded);
    }
}
