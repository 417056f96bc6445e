package com.branchat.backend.memory.model;

import java.time.Instant;

public record MemoryStats(
    long totalMemories,
    Instant oldestMemory,
    Instant newestMemory,
    double averageKeywords,
    boolean available,
    boolean vectorSupport) {

  public static MemoryStats unavailable() {
    return new MemoryStats(0, null, null, 0.0d, false, false);
  }
}
