package com.mcpgateway.registry.search.controller;

import com.mcpgateway.registry.common.model.AgentEntity;
import com.mcpgateway.registry.common.model.ServerEntity;
import com.mcpgateway.registry.search.dto.EntityStateRequest;
import com.mcpgateway.registry.search.dto.IndexResponse;
import com.mcpgateway.registry.search.dto.IndexStats;
import com.mcpgateway.registry.search.embedding.EmbeddingProvider;
import com.mcpgateway.registry.search.indexing.EntityIndexer;
import com.mcpgateway.registry.storage.index.VectorIndexStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/search/index")
@RequiredArgsConstructor
@Tag(name = "Search Index", description = "Write path of the search index, called when registry entities change")
public class IndexController {

    private final EntityIndexer indexer;
    private final VectorIndexStore store;
    private final EmbeddingProvider embeddingProvider;

    @PutMapping("/servers")
    @Operation(summary = "Index a server",
               description = "Embed a server and its tools and atomically replace its previous index entries")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Server indexed"),
        @ApiResponse(responseCode = "202", description = "Indexing scheduled in background"),
        @ApiResponse(responseCode = "400", description = "Invalid server definition"),
        @ApiResponse(responseCode = "503", description = "Embedding provider unavailable, indexing queued for retry")
    })
    public ResponseEntity<IndexResponse> indexServer(@Valid @RequestBody ServerEntity server,
                                                     @RequestParam(defaultValue = "false") boolean async) {
        log.info("Received index request for server {} with {} tools, async={}", server.path(), server.tools().size(), async);

        if (async) {
            indexer.indexServerAsync(server);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(IndexResponse.queued(server.path()));
        }
        return ResponseEntity.ok(IndexResponse.indexed(server.path(), indexer.indexServer(server)));
    }

    @PutMapping("/agents")
    @Operation(summary = "Index an agent",
               description = "Embed an A2A agent and replace its previous index entry")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Agent indexed"),
        @ApiResponse(responseCode = "202", description = "Indexing scheduled in background"),
        @ApiResponse(responseCode = "400", description = "Invalid agent definition"),
        @ApiResponse(responseCode = "503", description = "Embedding provider unavailable, indexing queued for retry")
    })
    public ResponseEntity<IndexResponse> indexAgent(@Valid @RequestBody AgentEntity agent,
                                                    @RequestParam(defaultValue = "false") boolean async) {
        log.info("Received index request for agent {}, async={}", agent.path(), async);

        if (async) {
            indexer.indexAgentAsync(agent);
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(IndexResponse.queued(agent.path()));
        }
        return ResponseEntity.ok(IndexResponse.indexed(agent.path(), indexer.indexAgent(agent)));
    }

    @DeleteMapping
    @Operation(summary = "Remove an entity",
               description = "Remove a server with all its tools, an agent, or a single tool entry")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Entity removed"),
        @ApiResponse(responseCode = "404", description = "Entity is not indexed")
    })
    public ResponseEntity<IndexResponse> remove(@RequestParam String path) {
        log.info("Received remove request for {}", path);

        int removed = indexer.removeEntity(path);
        if (removed == 0) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(IndexResponse.removed(path, removed));
    }

    @PatchMapping("/state")
    @Operation(summary = "Enable or disable an entity",
               description = "Toggle visibility in search results without re-embedding")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "State updated"),
        @ApiResponse(responseCode = "404", description = "Entity is not indexed, state recorded for later")
    })
    public ResponseEntity<Void> setState(@Valid @RequestBody EntityStateRequest request) {
        log.info("Received state change for {}: enabled={}", request.getPath(), request.getEnabled());

        boolean updated = indexer.setEnabled(request.getPath(), request.getEnabled());
        return updated ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/stats")
    @Operation(summary = "Index statistics", description = "Backend, search mode, record count and pending retries")
    @ApiResponse(responseCode = "200", description = "Statistics returned")
    public ResponseEntity<IndexStats> stats() {
        return ResponseEntity.ok(IndexStats.builder()
                .backend(store.backendName())
                .mode(store.mode().wireName())
                .records(store.size())
                .dimension(embeddingProvider.dimension())
                .pendingRetries(indexer.pendingRetries())
                .embedding(embeddingProvider.describe())
                .build());
    }
}
