package com.nevis.policy.ingest;

import com.nevis.policy.config.IngestionProperties;
import com.nevis.policy.exception.EmbeddingFailedException;
import com.nevis.policy.exception.ExtractionFailedException;
import com.nevis.policy.model.IngestionPhase;
import com.nevis.policy.service.EmbeddingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PdfTextProcessingCapabilityTest {

    private final PdfTextExtractor extractor = mock(PdfTextExtractor.class);
    private final EmbeddingService embeddingService = mock(EmbeddingService.class);
    private final PdfTextProcessingCapability capability = new PdfTextProcessingCapability(extractor,
        new PolicyTextChunker(200, 0), embeddingService, new IngestionProperties(200, 0, 2, 100, 1));

    @Test
    @DisplayName("Should embed chunks in batches and keep their order")
    void shouldEmbedInBatches() {
        when(extractor.extract(new byte[]{1})).thenReturn(List.of(
            new PageText(1, "Chapter 1 is short."),
            new PageText(2, "Chapter 2 is short too."),
            new PageText(3, "Annex A closes the document.")
        ));
        when(embeddingService.embedBatch(anyList())).thenAnswer(invocation -> {
            List<String> texts = invocation.getArgument(0);
            return texts.stream().map(text -> new float[]{text.length()}).toList();
        });
        List<IngestionPhase> phases = new ArrayList<>();
        List<Integer> progress = new ArrayList<>();

        ProcessedDocument document = capability.process(new byte[]{1}, new IngestionListener() {
            @Override
            public void onPhase(IngestionPhase phase) {
                phases.add(phase);
            }

            @Override
            public void onProgress(int processed, int total) {
                progress.add(processed);
            }
        });

        assertThat(document.pageCount()).isEqualTo(3);
        assertThat(document.chunks()).extracting(EmbeddedChunk::sectionRef)
            .containsExactly("Chapter 1", "Chapter 2", "Annex A");
        assertThat(document.chunks().get(2).embedding()).containsExactly((float) "Annex A closes the document.".length());
        assertThat(phases).containsExactly(IngestionPhase.EXTRACTING, IngestionPhase.EMBEDDING);
        assertThat(progress).containsExactly(2, 3);
        verify(embeddingService, times(2)).embedBatch(anyList());
    }

    @Test
    @DisplayName("Should fail extraction when no page has text")
    void shouldFailWithoutText() {
        when(extractor.extract(new byte[]{1})).thenReturn(List.of(new PageText(1, " ")));

        assertThatThrownBy(() -> capability.process(new byte[]{1}, IngestionListener.NO_OP))
            .isInstanceOf(ExtractionFailedException.class)
            .hasMessageContaining("1 pages");
        verify(embeddingService, never()).embedBatch(anyList());
    }

    @Test
    @DisplayName("Should report provider errors as embedding failures")
    void shouldWrapEmbeddingErrors() {
        when(extractor.extract(new byte[]{1})).thenReturn(List.of(new PageText(1, "Chapter 1 text.")));
        when(embeddingService.embedBatch(anyList())).thenThrow(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> capability.process(new byte[]{1}, IngestionListener.NO_OP))
            .isInstanceOf(EmbeddingFailedException.class)
            .hasMessageContaining("quota exceeded");
    }
}
