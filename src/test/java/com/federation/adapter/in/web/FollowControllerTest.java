package com.federation.adapter.in.web;

import com.federation.application.port.in.AddFollowEdgeUseCase;
import com.federation.application.port.in.GetFollowEdgesUseCase;
import com.federation.application.port.in.GetSessionStatusUseCase;
import com.federation.application.port.in.RemoveFollowEdgeUseCase;
import com.federation.domain.error.FollowError;
import com.federation.domain.error.ValidationError;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.Page;
import com.federation.domain.model.Result;
import com.federation.domain.model.SessionSnapshot;
import com.federation.domain.model.SessionStatus;
import com.federation.domain.model.SiteAddress;
import com.federation.domain.model.TransportKind;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.federation.adapter.in.web.WebTestConfig.NOW;
import static com.federation.adapter.in.web.WebTestConfig.OWNER_KEY;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SuppressWarnings("removal")
@WebMvcTest(FollowController.class)
@Import(WebTestConfig.class)
class FollowControllerTest {

    private static final SiteAddress TARGET = SiteAddress.fromTrusted("A");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AddFollowEdgeUseCase addFollowEdgeUseCase;

    @MockBean
    private RemoveFollowEdgeUseCase removeFollowEdgeUseCase;

    @MockBean
    private GetFollowEdgesUseCase getFollowEdgesUseCase;

    @MockBean
    private GetSessionStatusUseCase getSessionStatusUseCase;

    private static FollowEdge edge() {
        return new FollowEdge(UUID.randomUUID(), TARGET, "Site A", true, List.of(TARGET), NOW);
    }

    @Test
    void shouldAddFollowEdge() throws Exception {
        FollowEdge edge = edge();
        when(addFollowEdgeUseCase.addFollowEdge(eq(TARGET), eq("Site A"), eq(true), anyList()))
            .thenReturn(Result.success(edge));

        mockMvc.perform(post("/api/v1/follows")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"A\",\"name\":\"Site A\",\"recursive\":true}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(edge.id().toString()))
            .andExpect(jsonPath("$.targetAddress").value("A"))
            .andExpect(jsonPath("$.recursive").value(true))
            .andExpect(jsonPath("$.followChain[0]").value("A"));
    }

    @Test
    void shouldRejectMissingSiteKey() throws Exception {
        mockMvc.perform(post("/api/v1/follows")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"A\"}"))
            .andExpect(status().isUnauthorized())
            .andExpect(jsonPath("$.error").value("UNAUTHORIZED"));
    }

    @Test
    void shouldForbidForeignKey() throws Exception {
        mockMvc.perform(post("/api/v1/follows")
                .header("X-Site-Key", "someone-else")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"A\"}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.error").value("FORBIDDEN"));

        verifyNoInteractions(addFollowEdgeUseCase);
    }

    @Test
    void shouldRejectInvalidAddress() throws Exception {
        mockMvc.perform(post("/api/v1/follows")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"not a site\"}"))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(addFollowEdgeUseCase);
    }

    @Test
    void shouldRejectBlankAddress() throws Exception {
        mockMvc.perform(post("/api/v1/follows")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    void shouldReturnConflictWhenAlreadyFollowing() throws Exception {
        when(addFollowEdgeUseCase.addFollowEdge(eq(TARGET), isNull(), eq(false), anyList()))
            .thenReturn(Result.failure(new FollowError.AlreadyFollowing(TARGET)));

        mockMvc.perform(post("/api/v1/follows")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"A\"}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("ALREADY_FOLLOWING"));
    }

    @Test
    void shouldRejectSelfFollow() throws Exception {
        when(addFollowEdgeUseCase.addFollowEdge(any(), any(), anyBoolean(), anyList()))
            .thenReturn(Result.failure(new FollowError.ValidationFailed(
                ValidationError.FollowValidationError.SelfFollow.INSTANCE)));

        mockMvc.perform(post("/api/v1/follows")
                .header("X-Site-Key", OWNER_KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"targetAddress\":\"B\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldRemoveFollowEdge() throws Exception {
        UUID edgeId = UUID.randomUUID();
        when(removeFollowEdgeUseCase.removeFollowEdge(edgeId)).thenReturn(Result.ok());

        mockMvc.perform(delete("/api/v1/follows/" + edgeId)
                .header("X-Site-Key", OWNER_KEY))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.edgeId").value(edgeId.toString()))
            .andExpect(jsonPath("$.status").value("unfollowed"));
    }

    @Test
    void shouldReturnNotFoundWhenRemovingUnknownEdge() throws Exception {
        UUID edgeId = UUID.randomUUID();
        when(removeFollowEdgeUseCase.removeFollowEdge(edgeId))
            .thenReturn(Result.failure(new FollowError.NotFollowing(edgeId.toString())));

        mockMvc.perform(delete("/api/v1/follows/" + edgeId)
                .header("X-Site-Key", OWNER_KEY))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("NOT_FOLLOWING"));
    }

    @Test
    void shouldListFollowEdgesWithClampedLimit() throws Exception {
        when(getFollowEdgesUseCase.getFollowEdges(isNull(), eq(100)))
            .thenReturn(Page.of(List.of(edge()), NOW.toString()));

        mockMvc.perform(get("/api/v1/follows").param("limit", "500"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data[0].targetAddress").value("A"))
            .andExpect(jsonPath("$.pagination.hasMore").value(true));
    }

    @Test
    void shouldReturnSessionStatus() throws Exception {
        UUID edgeId = UUID.randomUUID();
        when(getSessionStatusUseCase.getSession(edgeId)).thenReturn(Optional.of(
            new SessionSnapshot(edgeId, TARGET, SessionStatus.DEGRADED, NOW, 2, TransportKind.REAL_TIME)));

        mockMvc.perform(get("/api/v1/follows/" + edgeId + "/session"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("DEGRADED"))
            .andExpect(jsonPath("$.reconnectAttempts").value(2))
            .andExpect(jsonPath("$.transport").value("REAL_TIME"));
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() throws Exception {
        UUID edgeId = UUID.randomUUID();
        when(getSessionStatusUseCase.getSession(edgeId)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/follows/" + edgeId + "/session"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("EDGE_NOT_FOUND"));
    }
}
