package com.federation.adapter.in.web;

import com.federation.application.port.in.QueryFederationIndexUseCase;
import com.federation.application.port.in.WriteFederationIndexUseCase;
import com.federation.domain.error.IndexWriteError;
import com.federation.domain.model.FederationIndexEntry;
import com.federation.domain.model.IndexQuery;
import com.federation.domain.model.IndexStats;
import com.federation.domain.model.Result;
import com.federation.infrastructure.exception.StoreException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.federation.adapter.in.web.WebTestConfig.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(FederationIndexController.class)
@Import(WebTestConfig.class)
class FederationIndexControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryFederationIndexUseCase queryUseCase;

    @MockBean
    private WriteFederationIndexUseCase writeUseCase;

    private static FederationIndexEntry entry() {
        return new FederationIndexEntry("A:loc-1", "loc-1", "Night Drive", null, "music", "A", "Site A", "video",
            null, NOW, List.of("synth"), false, false, null, null);
    }

    @Test
    void shouldListRecentEntries() throws Exception {
        when(queryUseCase.getRecent(10, 5)).thenReturn(List.of(entry()));

        mockMvc.perform(get("/api/v1/federation-index/recent").param("limit", "10").param("offset", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("A:loc-1"))
            .andExpect(jsonPath("$[0].tags[0]").value("synth"));
    }

    @Test
    void shouldQueryByRepeatedTags() throws Exception {
        when(queryUseCase.getByTags(List.of("synth", "jazz"))).thenReturn(List.of(entry()));

        mockMvc.perform(get("/api/v1/federation-index/tags").param("tag", "synth", "jazz"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void shouldParseTimeRange() throws Exception {
        Instant after = Instant.parse("2026-01-01T00:00:00Z");
        when(queryUseCase.getByTimeRange(after, null)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/federation-index/range").param("after", "2026-01-01T00:00:00Z"))
            .andExpect(status().isOk());

        verify(queryUseCase).getByTimeRange(after, null);
    }

    @Test
    void shouldAcceptCompositeQueryWithoutSiteKey() throws Exception {
        when(queryUseCase.query(any())).thenReturn(List.of(entry()));

        mockMvc.perform(post("/api/v1/federation-index/query")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\":\"night\",\"sourceSiteId\":\"A\",\"tags\":[\"synth\"],\"limit\":5}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].sourceSiteId").value("A"));

        ArgumentCaptor<IndexQuery> captor = ArgumentCaptor.forClass(IndexQuery.class);
        verify(queryUseCase).query(captor.capture());
        assertEquals("night", captor.getValue().text());
        assertEquals(5, captor.getValue().limit());
        assertEquals(0, captor.getValue().offset());
    }

    @Test
    void shouldReturnStats() throws Exception {
        when(queryUseCase.getStats()).thenReturn(new IndexStats(1, Map.of("A", 1L), Map.of("video", 1L), NOW, NOW));

        mockMvc.perform(get("/api/v1/federation-index/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalEntries").value(1))
            .andExpect(jsonPath("$.entriesBySite.A").value(1));
    }

    @Test
    void shouldInsertEntryWithDefaults() throws Exception {
        when(writeUseCase.insert(any(), eq("A"))).thenAnswer(inv -> Result.success(inv.getArgument(0)));

        mockMvc.perform(post("/api/v1/federation-index/entries")
                .header("X-Site-Key", "A")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contentLocator\":\"loc-9\",\"sourceSiteId\":\"A\"}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.title").value(FederationIndexEntry.DEFAULT_TITLE))
            .andExpect(jsonPath("$.contentType").value(FederationIndexEntry.DEFAULT_CONTENT_TYPE))
            .andExpect(jsonPath("$.sourceSiteName").value("A"));
    }

    @Test
    void shouldRejectDeniedWrites() throws Exception {
        when(writeUseCase.insert(any(), eq("X"))).thenReturn(Result.failure(new IndexWriteError.Denied("X")));

        mockMvc.perform(post("/api/v1/federation-index/entries")
                .header("X-Site-Key", "X")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"contentLocator\":\"loc-9\",\"sourceSiteId\":\"X\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("INDEX_WRITE_DENIED"));
    }

    @Test
    void shouldRequireSiteKeyToWrite() throws Exception {
        mockMvc.perform(delete("/api/v1/federation-index/entries/A:loc-1"))
            .andExpect(status().isUnauthorized());
    }

    @Test
    void shouldRemoveEntry() throws Exception {
        when(writeUseCase.remove("A:loc-1", "A")).thenReturn(Result.ok());

        mockMvc.perform(delete("/api/v1/federation-index/entries/A:loc-1").header("X-Site-Key", "A"))
            .andExpect(status().isNoContent());
    }

    @Test
    void shouldReportMissingEntry() throws Exception {
        when(writeUseCase.remove("A:gone", "A")).thenReturn(Result.failure(new IndexWriteError.NotFound("A:gone")));

        mockMvc.perform(delete("/api/v1/federation-index/entries/A:gone").header("X-Site-Key", "A"))
            .andExpect(status().isNotFound());
    }

    @Test
    void shouldReportUnavailableStore() throws Exception {
        when(queryUseCase.getFeatured()).thenThrow(new StoreException("redis down"));

        mockMvc.perform(get("/api/v1/federation-index/featured"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("STORE_UNAVAILABLE"));
    }
}
