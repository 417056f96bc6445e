package com.branchat.backend.memory.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.branchat.backend.chat.provider.model.StructuredSummary;
import com.branchat.backend.memory.config.MemoryProperties;
import com.branchat.backend.memory.model.MemoryDocument;
import com.branchat.backend.memory.model.MemorySearchOptions;
import com.branchat.backend.memory.model.MemorySearchResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MemoryServiceTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private static final String USER_ID = "user-1";

  @Mock private MemoryIndex memoryIndex;

  private SimpleMeterRegistry meterRegistry;
  private MemoryService service;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    service =
        new MemoryService(
            memoryIndex,
            new MemoryProperties(),
            meterRegistry,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @AfterEach
  void tearDown() {
    meterRegistry.close();
  }

  @Test
  void storeMemoryWritesSummaryWithKeywords() {
    UUID subChatId = UUID.randomUUID();
    UUID conversationId = UUID.randomUUID();
    when(memoryIndex.isAvailable()).thenReturn(true);
    when(memoryIndex.upsert(eq(subChatId), any(MemoryDocument.class))).thenReturn(true);

    boolean stored =
        service.storeMemory(
            subChatId,
            conversationId,
            USER_ID,
            new StructuredSummary(
                "Chose Postgres", List.of("Write schema"), List.of(), List.of("database", "jsonb")),
            NOW.minusSeconds(60),
            null);

    assertThat(stored).isTrue();
    ArgumentCaptor<MemoryDocument> captor = ArgumentCaptor.forClass(MemoryDocument.class);
    verify(memoryIndex).upsert(eq(subChatId), captor.capture());
    assertThat(captor.getValue().conversationId()).isEqualTo(conversationId);
    assertThat(captor.getValue().embeddingText()).isEqualTo("Chose Postgres database jsonb");
    assertThat(captor.getValue().actions()).containsExactly("Write schema");
    assertThat(captor.getValue().mergedAt()).isEqualTo(NOW);
    assertThat(meterRegistry.counter("memory_store_total").count()).isEqualTo(1.0);
  }

  @Test
  void storeMemoryCountsRejectedWrites() {
    UUID subChatId = UUID.randomUUID();
    when(memoryIndex.isAvailable()).thenReturn(true);
    when(memoryIndex.upsert(eq(subChatId), any(MemoryDocument.class))).thenReturn(false);

    boolean stored =
        service.storeMemory(
            subChatId,
            UUID.randomUUID(),
            USER_ID,
            new StructuredSummary("Summary", List.of(), List.of(), List.of()),
            NOW,
            NOW);

    assertThat(stored).isFalse();
    assertThat(meterRegistry.counter("memory_store_failures_total").count()).isEqualTo(1.0);
  }

  @Test
  void storeMemoryReportsFalseWhenIndexUnavailable() {
    when(memoryIndex.isAvailable()).thenReturn(false);

    boolean stored =
        service.storeMemory(
            UUID.randomUUID(),
            UUID.randomUUID(),
            USER_ID,
            new StructuredSummary("Summary", List.of(), List.of(), List.of()),
            NOW,
            NOW);

    assertThat(stored).isFalse();
    verify(memoryIndex, never()).upsert(any(), any());
    assertThat(meterRegistry.counter("memory_store_failures_total").count()).isEqualTo(1.0);
  }

  @Test
  void relevantMemoriesExcludeCurrentConversation() {
    UUID currentConversation = UUID.randomUUID();
    MemorySearchResult hit =
        new MemorySearchResult(
            UUID.randomUUID(), UUID.randomUUID(), 1.5, "summary", List.of(), List.of(), List.of(),
            NOW, NOW);
    when(memoryIndex.isAvailable()).thenReturn(true);
    when(memoryIndex.search(eq("kafka lag"), eq(USER_ID), any(MemorySearchOptions.class)))
        .thenReturn(List.of(hit));

    List<MemorySearchResult> results =
        service.getRelevantMemories("kafka lag", USER_ID, currentConversation, null);

    assertThat(results).containsExactly(hit);
    ArgumentCaptor<MemorySearchOptions> captor = ArgumentCaptor.forClass(MemorySearchOptions.class);
    verify(memoryIndex).search(eq("kafka lag"), eq(USER_ID), captor.capture());
    assertThat(captor.getValue().topK()).isEqualTo(5);
    assertThat(captor.getValue().threshold()).isEqualTo(0.7);
    assertThat(captor.getValue().excludeConversationId()).isEqualTo(currentConversation);
  }

  @Test
  void searchReturnsEmptyWhenIndexUnavailable() {
    when(memoryIndex.isAvailable()).thenReturn(false);

    assertThat(service.searchMemories("kafka", USER_ID, 3)).isEmpty();
    verify(memoryIndex, never()).search(any(), any(), any());
  }

  @Test
  void cleanupTranslatesAgeIntoCutoff() {
    when(memoryIndex.cleanup(USER_ID, NOW.minus(Duration.ofDays(30)), 10)).thenReturn(4);

    assertThat(service.cleanupUserMemories(USER_ID, 30, 10)).isEqualTo(4);
  }
}
