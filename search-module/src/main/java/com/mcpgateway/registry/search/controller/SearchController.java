package com.mcpgateway.registry.search.controller;

import com.mcpgateway.registry.common.model.SearchRequest;
import com.mcpgateway.registry.common.model.SearchResultSet;
import com.mcpgateway.registry.search.engine.HybridSearchEngine;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
@Tag(name = "Semantic Search", description = "Hybrid semantic search over MCP servers, tools and A2A agents")
public class SearchController {

    private final HybridSearchEngine searchEngine;

    @PostMapping("/semantic")
    @Operation(summary = "Search the registry",
               description = "Rank servers, tools and agents by semantic similarity boosted by keyword matches")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Search completed, possibly in degraded keyword-only mode"),
        @ApiResponse(responseCode = "400", description = "Malformed request")
    })
    public ResponseEntity<SearchResultSet> search(@Valid @RequestBody SearchRequest request) {
        log.info("Received search request: query length={}, types={}, maxResults={}",
                request.query().length(), request.entityTypes(), request.maxResults());

        return ResponseEntity.ok(searchEngine.search(request));
    }
}
