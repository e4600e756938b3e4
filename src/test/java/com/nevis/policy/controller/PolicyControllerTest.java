package com.nevis.policy.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.policy.exception.DocumentAlreadyExistsException;
import com.nevis.policy.exception.EntityNotFoundException;
import com.nevis.policy.exception.InvalidSourceException;
import com.nevis.policy.index.TimelineEntry;
import com.nevis.policy.model.DocumentDetail;
import com.nevis.policy.model.DocumentSummary;
import com.nevis.policy.model.EffectiveSnapshot;
import com.nevis.policy.model.PolicyCategory;
import com.nevis.policy.model.PolicyDocument;
import com.nevis.policy.model.PolicyRevision;
import com.nevis.policy.model.Resolution;
import com.nevis.policy.model.ResolutionOutcome;
import com.nevis.policy.model.RevisionStatus;
import com.nevis.policy.service.EffectiveDateResolver;
import com.nevis.policy.service.PolicyRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PolicyController.class)
class PolicyControllerTest {

    private static final LocalDate TODAY = LocalDate.of(2025, 3, 1);

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private PolicyRegistry registry;

    @MockitoBean
    private EffectiveDateResolver resolver;

    @Test
    @DisplayName("POST /policies should register a policy and return 201")
    void createPolicy_ShouldReturn201() throws Exception {
        when(registry.createDocument("NPPF", "National Planning Policy Framework", null, PolicyCategory.NATIONAL_POLICY))
            .thenReturn(document("NPPF"));

        mockMvc.perform(post("/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(
                    new CreatePolicyRequest("NPPF", "National Planning Policy Framework", null,
                        PolicyCategory.NATIONAL_POLICY))))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.source").value("NPPF"))
            .andExpect(jsonPath("$.category").value("national_policy"));
    }

    @Test
    @DisplayName("POST /policies should return 400 for a malformed source")
    void createPolicy_ShouldReturn400_WhenSourceInvalid() throws Exception {
        when(registry.createDocument(eq("nppf"), any(), any(), any())).thenThrow(new InvalidSourceException("nppf"));

        mockMvc.perform(post("/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"nppf\",\"title\":\"t\",\"category\":\"national_policy\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("INVALID_IDENTITY"));
    }

    @Test
    @DisplayName("POST /policies should return 409 for an existing source")
    void createPolicy_ShouldReturn409_WhenDuplicate() throws Exception {
        when(registry.createDocument(eq("NPPF"), any(), any(), any())).thenThrow(new DocumentAlreadyExistsException("NPPF"));

        mockMvc.perform(post("/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"NPPF\",\"title\":\"t\",\"category\":\"national_policy\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("ALREADY_EXISTS"))
            .andExpect(jsonPath("$.message").value("Policy already exists: NPPF"));
    }

    @Test
    @DisplayName("POST /policies should validate required fields before reaching the registry")
    void createPolicy_ShouldReturn400_WhenTitleMissing() throws Exception {
        mockMvc.perform(post("/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"NPPF\",\"category\":\"national_policy\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errorCode").value("BAD_REQUEST"));

        mockMvc.perform(post("/policies")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\":\"NPPF\",\"title\":\"t\",\"category\":\"unknown\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(registry);
    }

    @Test
    @DisplayName("GET /policies should filter by category and report today's revision")
    void listPolicies_ShouldUseTodayAndFilters() throws Exception {
        when(registry.listDocuments(PolicyCategory.NATIONAL_GUIDANCE, null, TODAY))
            .thenReturn(List.of(new DocumentSummary(document("LTN_1_20"), revision("rev_LTN_1_20_2020_07_27"), 1)));

        mockMvc.perform(get("/policies").param("category", "national_guidance"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].current_revision.revision_id").value("rev_LTN_1_20_2020_07_27"))
            .andExpect(jsonPath("$[0].revision_count").value(1));
    }

    @Test
    @DisplayName("GET /policies/{source} should return the policy with its revisions")
    void getPolicy_ShouldReturnDetails() throws Exception {
        PolicyRevision current = revision("rev_NPPF_2024_12_12");
        when(registry.getDocument("NPPF", TODAY))
            .thenReturn(new DocumentDetail(document("NPPF"), List.of(current), current));

        mockMvc.perform(get("/policies/{source}", "NPPF"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.revisions", hasSize(1)))
            .andExpect(jsonPath("$.current_revision.status").value("active"));
    }

    @Test
    @DisplayName("GET /policies/{source} should return 404 for an unknown policy")
    void getPolicy_ShouldReturn404() throws Exception {
        when(registry.getDocument("UNKNOWN", TODAY)).thenThrow(EntityNotFoundException.document("UNKNOWN"));

        mockMvc.perform(get("/policies/{source}", "UNKNOWN"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("RESOURCE_NOT_FOUND"))
            .andExpect(jsonPath("$.message").value("Policy not found: UNKNOWN"));
    }

    @Test
    @DisplayName("PATCH /policies/{source} should update metadata")
    void updatePolicy_ShouldReturnUpdated() throws Exception {
        when(registry.updateDocument(eq("NPPF"), any())).thenReturn(document("NPPF"));

        mockMvc.perform(patch("/policies/{source}", "NPPF")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"description\":\"new\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.source").value("NPPF"));
    }

    @Test
    @DisplayName("GET /policies/{source}/effective should resolve the revision in force")
    void effectiveRevision_ShouldResolve() throws Exception {
        LocalDate date = LocalDate.of(2024, 12, 12);
        when(resolver.resolve("NPPF", date)).thenReturn(new Resolution("NPPF", date, ResolutionOutcome.IN_FORCE,
            new TimelineEntry("rev_NPPF_2024_12_12", "December 2024", date, null, RevisionStatus.ACTIVE)));

        mockMvc.perform(get("/policies/{source}/effective", "NPPF").param("date", "2024-12-12"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("IN_FORCE"))
            .andExpect(jsonPath("$.revision.revision_id").value("rev_NPPF_2024_12_12"));
    }

    @Test
    @DisplayName("GET /policies/{source}/effective should return 200 without revision before the first one")
    void effectiveRevision_ShouldReturnNothingInForce() throws Exception {
        LocalDate date = LocalDate.of(2020, 1, 1);
        when(resolver.resolve("NPPF", date))
            .thenReturn(new Resolution("NPPF", date, ResolutionOutcome.NOT_YET_EFFECTIVE, null));

        mockMvc.perform(get("/policies/{source}/effective", "NPPF").param("date", "2020-01-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.outcome").value("NOT_YET_EFFECTIVE"))
            .andExpect(jsonPath("$.revision").doesNotExist());
    }

    @Test
    @DisplayName("GET /policies/{source}/effective should return 400 for a malformed date")
    void effectiveRevision_ShouldReturn400_WhenDateMalformed() throws Exception {
        mockMvc.perform(get("/policies/{source}/effective", "NPPF").param("date", "12/12/2024"))
            .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /policies/effective should return the snapshot grouped by outcome")
    void effectiveSnapshot_ShouldGroup() throws Exception {
        LocalDate date = LocalDate.of(2021, 1, 1);
        Resolution inForce = new Resolution("LTN_1_20", date, ResolutionOutcome.IN_FORCE,
            new TimelineEntry("rev_LTN_1_20_2020_07_27", "July 2020", LocalDate.of(2020, 7, 27), null,
                RevisionStatus.ACTIVE));
        when(resolver.resolveSnapshot(date)).thenReturn(new EffectiveSnapshot(date,
            Map.of("LTN_1_20", inForce), List.of("LTN_1_20"), List.of("NPPF"), List.of(), List.of("DRAFT_SPD")));

        mockMvc.perform(get("/policies/effective").param("date", "2021-01-01"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.policies", hasSize(1)))
            .andExpect(jsonPath("$.policies[0].source").value("LTN_1_20"))
            .andExpect(jsonPath("$.not_yet_effective[0]").value("NPPF"))
            .andExpect(jsonPath("$.no_revisions[0]").value("DRAFT_SPD"));
    }

    private static PolicyDocument document(String source) {
        OffsetDateTime now = OffsetDateTime.parse("2025-01-01T00:00:00Z");
        return new PolicyDocument(source, "Title of " + source, null, PolicyCategory.NATIONAL_POLICY, 1L, now, now);
    }

    private static PolicyRevision revision(String id) {
        return new PolicyRevision(id, "NPPF", "label", LocalDate.of(2024, 12, 12), null, RevisionStatus.ACTIVE,
            "ref", 10L, 3, 12, null, null, null, null, null, null);
    }
}
