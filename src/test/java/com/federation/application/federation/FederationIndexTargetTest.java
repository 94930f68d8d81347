package com.federation.application.federation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.federation.application.port.out.AccessControl;
import com.federation.application.port.out.FollowEdgeRepository;
import com.federation.application.service.FederationIndexService;
import com.federation.application.service.IndexWritePolicy;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.support.InMemoryFederationIndexRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;

import static com.federation.support.TestData.NOW;
import static com.federation.support.TestData.edge;
import static com.federation.support.TestData.entry;
import static com.federation.support.TestData.node;
import static com.federation.support.TestData.original;
import static com.federation.support.TestData.site;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FederationIndexTarget")
class FederationIndexTargetTest {

    @Mock
    private FollowEdgeRepository followEdgeRepository;

    @Mock
    private AccessControl accessControl;

    private InMemoryFederationIndexRepository repository;
    private FederationIndexTarget target;
    private final FollowEdge edge = edge("B", "A", false);

    @BeforeEach
    void setUp() {
        repository = new InMemoryFederationIndexRepository();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        FederationIndexService index = new FederationIndexService(repository,
            new IndexWritePolicy(node("B"), followEdgeRepository, accessControl), clock);
        target = new FederationIndexTarget(index, repository, new IndexEntryMapper(new ObjectMapper()), clock);
    }

    @Test
    @DisplayName("Should write a pointer acting as the followed site")
    void shouldWriteAsFollowedSite() {
        // Given
        when(followEdgeRepository.existsByTarget(site("A"))).thenReturn(true);
        when(accessControl.canWrite("A")).thenReturn(true);
        ContentItem item = original("r1");

        // When
        boolean written = target.write(item.federate(site("A"), NOW, true), edge);

        // Then
        assertTrue(written);
        assertTrue(target.contains(item, edge));
    }

    @Test
    @DisplayName("Should report a denied write as not written")
    void shouldReportDeniedWrite() {
        // Given
        when(followEdgeRepository.existsByTarget(site("A"))).thenReturn(true);
        when(accessControl.canWrite("A")).thenReturn(false);

        // When
        boolean written = target.write(original("r1").federate(site("A"), NOW, true), edge);

        // Then
        assertFalse(written);
        assertEquals(0, repository.size());
    }

    @Test
    @DisplayName("Should only evict pointers attributed to the edge target")
    void shouldEvictOnlyTargetPointers() {
        // Given
        when(followEdgeRepository.existsByTarget(site("A"))).thenReturn(true);
        when(accessControl.canWrite("A")).thenReturn(true);
        repository.put(entry("A", "loc-r1", NOW));
        repository.put(entry("C", "loc-c1", NOW));
        ContentItem relayed = new ContentItem("c1", "Item c1", "music", "loc-c1", null, null, "C", NOW, true);

        // When
        boolean evictedOwn = target.evict(original("r1"), edge);
        boolean evictedRelayed = target.evict(relayed, edge);
        boolean evictedMissing = target.evict(original("gone"), edge);

        // Then
        assertTrue(evictedOwn);
        assertFalse(evictedRelayed);
        assertFalse(evictedMissing);
        assertEquals(1, repository.size());
    }
}
