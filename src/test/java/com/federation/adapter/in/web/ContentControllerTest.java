package com.federation.adapter.in.web;

import com.federation.application.port.in.PublishContentUseCase;
import com.federation.domain.error.ValidationError.ContentError;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.Result;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static com.federation.adapter.in.web.WebTestConfig.NOW;
import static com.federation.adapter.in.web.WebTestConfig.OWNER_KEY;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(ContentController.class)
@Import(WebTestConfig.class)
class ContentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private PublishContentUseCase publishContentUseCase;

    @Test
    void shouldPublishContentWithMetadataDocument() throws Exception {
        ContentItem item = new ContentItem("clip-1", "Clip", "music", "loc-1", null,
            "{\"tags\":[\"jazz\"]}", null, null, null);
        when(publishContentUseCase.publish(eq("clip-1"), eq("Clip"), eq("music"), eq("loc-1"), isNull(),
            eq("{\"tags\":[\"jazz\"]}"))).thenReturn(Result.success(item));

        mockMvc.perform(post("/api/v1/content")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("""
                    {"id":"clip-1","name":"Clip","categoryId":"music","contentLocator":"loc-1",
                     "metadata":{"tags":["jazz"]}}
                    """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value("clip-1"))
            .andExpect(jsonPath("$.federatedFrom").doesNotExist());
    }

    @Test
    void shouldRejectIncompleteContent() throws Exception {
        when(publishContentUseCase.publish(any(), any(), any(), any(), any(), any()))
            .thenReturn(Result.failure(new ContentError.MissingField("contentLocator")));

        mockMvc.perform(post("/api/v1/content")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"clip-1\",\"name\":\"Clip\",\"categoryId\":\"music\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldForbidPublishingWithForeignKey() throws Exception {
        mockMvc.perform(post("/api/v1/content")
                .header("X-Site-Key", "A")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"id\":\"clip-1\"}"))
            .andExpect(status().isForbidden());

        verifyNoInteractions(publishContentUseCase);
    }

    @Test
    void shouldDeleteContent() throws Exception {
        when(publishContentUseCase.delete("clip-1"))
            .thenReturn(Optional.of(ContentItem.original("clip-1", "Clip", "music", "loc-1")));

        mockMvc.perform(delete("/api/v1/content/clip-1")
                .header("X-Site-Key", OWNER_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value("clip-1"));
    }

    @Test
    void shouldReturnNotFoundForUnknownContent() throws Exception {
        when(publishContentUseCase.delete("missing")).thenReturn(Optional.empty());

        mockMvc.perform(delete("/api/v1/content/missing")
                .header("X-Site-Key", OWNER_KEY))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("CONTENT_NOT_FOUND"));
    }

    @Test
    void shouldListOriginalsWithoutSiteKey() throws Exception {
        when(publishContentUseCase.listContent(true)).thenReturn(List.of(
            ContentItem.original("clip-1", "Clip", "music", "loc-1")));

        mockMvc.perform(get("/api/v1/content").param("originalsOnly", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("clip-1"));
    }

    @Test
    void shouldShowProvenanceOfFederatedItems() throws Exception {
        ContentItem imported = new ContentItem("c1", "Clip", "music", "loc-1", null, null, "A", NOW, true);
        when(publishContentUseCase.listContent(false)).thenReturn(List.of(imported));

        mockMvc.perform(get("/api/v1/content"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].federatedFrom").value("A"))
            .andExpect(jsonPath("$[0].federatedRealtime").value(true));
    }
}
