package com.branchat.backend.memory.api;

import com.branchat.backend.memory.model.MemorySearchResult;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;

@Schema(description = "Memories matching a query, best match first.")
public record MemorySearchResponse(
    @Schema(description = "Query the results were ranked against.") String query,
    @Schema(description = "Whether the memory store served the request.") boolean available,
    @Schema(description = "Ranked results.") List<MemorySearchResult> results) {}
