package com.nevis.policy.controller;

import com.nevis.policy.exception.QueryEmbeddingException;
import com.nevis.policy.exception.SectionNotFoundException;
import com.nevis.policy.exception.WrongQueryException;
import com.nevis.policy.model.ChunkMatch;
import com.nevis.policy.model.SectionContent;
import com.nevis.policy.service.TemporalSearchService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private TemporalSearchService searchService;

    @Test
    @DisplayName("GET /search should return temporally tagged matches")
    void search_ShouldReturnMatches() throws Exception {
        ChunkMatch match = new ChunkMatch("LTN_1_20__rev__Chapter_11__000", "Cycle parking standards", 0.87,
            "LTN_1_20", "rev_LTN_1_20_2020_07_27", "July 2020", LocalDate.of(2020, 7, 27), null, "Chapter 11", 112);
        when(searchService.search("cycle parking standards", List.of("LTN_1_20"), LocalDate.of(2021, 1, 1), 5))
            .thenReturn(List.of(match));

        mockMvc.perform(get("/search")
                .param("q", "cycle parking standards")
                .param("source", "LTN_1_20")
                .param("as_of", "2021-01-01")
                .param("limit", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.as_of").value("2021-01-01"))
            .andExpect(jsonPath("$.results", hasSize(1)))
            .andExpect(jsonPath("$.results[0].revision_id").value("rev_LTN_1_20_2020_07_27"))
            .andExpect(jsonPath("$.results[0].section_ref").value("Chapter 11"))
            .andExpect(jsonPath("$.results[0].page_number").value(112));
    }

    @Test
    @DisplayName("GET /search should return 200 with no results before any revision was in force")
    void search_ShouldReturnEmptyList() throws Exception {
        when(searchService.search(anyString(), any(), eq(LocalDate.of(2019, 1, 1)), isNull())).thenReturn(List.of());

        mockMvc.perform(get("/search")
                .param("q", "cycle parking standards")
                .param("source", "LTN_1_20")
                .param("as_of", "2019-01-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results", hasSize(0)));
    }

    @Test
    @DisplayName("GET /search should return 400 for a rejected query")
    void search_ShouldReturn400_WhenQueryTooShort() throws Exception {
        when(searchService.search(eq("ab"), any(), any(), any())).thenThrow(new WrongQueryException("Query too short"));

        mockMvc.perform(get("/search").param("q", "ab"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Query too short"));
    }

    @Test
    @DisplayName("GET /search should return 400 without a query")
    void search_ShouldReturn400_WhenQueryMissing() throws Exception {
        mockMvc.perform(get("/search"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /search should return 503 when the embedding provider is down")
    void search_ShouldReturn503_WhenEmbeddingFails() throws Exception {
        when(searchService.search(anyString(), any(), any(), any()))
            .thenThrow(new QueryEmbeddingException("Error during query vectorization", new RuntimeException()));

        mockMvc.perform(get("/search").param("q", "housing supply"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode").value("EMBEDDING_UNAVAILABLE"));
    }

    @Test
    @DisplayName("GET sections should read from the revision in force today")
    void getSection_ShouldUseToday() throws Exception {
        when(searchService.getSection("NPPF", "Paragraph 11", null, LocalDate.of(2025, 3, 1)))
            .thenReturn(new SectionContent("NPPF", "rev_NPPF_2024_12_12", "December 2024", "Paragraph 11",
                "Plans and decisions should apply a presumption", List.of(4, 5)));

        mockMvc.perform(get("/policies/{source}/sections", "NPPF").param("ref", "Paragraph 11"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.revision_id").value("rev_NPPF_2024_12_12"))
            .andExpect(jsonPath("$.page_numbers", hasSize(2)));
    }

    @Test
    @DisplayName("GET sections should return 404 for an unknown section")
    void getSection_ShouldReturn404() throws Exception {
        when(searchService.getSection(eq("NPPF"), eq("Annex Z"), isNull(), any()))
            .thenThrow(new SectionNotFoundException("NPPF", "Annex Z", "Section 'Annex Z' not found"));

        mockMvc.perform(get("/policies/{source}/sections", "NPPF").param("ref", "Annex Z"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("SECTION_NOT_FOUND"));
    }
}
