package com.purchasingpower.archiverag.api;

import com.purchasingpower.archiverag.core.QueryResult;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.exception.QueryTimeoutException;
import com.purchasingpower.archiverag.exception.QueryValidationException;
import com.purchasingpower.archiverag.service.QueryOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.function.Supplier;

/**
 * REST controller for archive questions.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class QueryController {

    private final QueryOrchestrator queryOrchestrator;

    /**
     * Answer a free-text question.
     *
     * POST /api/v1/query
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@RequestBody QueryRequest request) {
        log.info("Query request from {}: {}", request.getUserId(), request.getQuery());
        return execute("Query", () -> queryOrchestrator.executeQuery(request.getQuery(), request.getUserId()));
    }

    /**
     * Structured relationship lookup.
     *
     * POST /api/v1/relationships
     */
    @PostMapping("/relationships")
    public ResponseEntity<QueryResponse> relationships(@RequestBody RelationshipRequest request) {
        log.info("Relationship request from {}: {} '{}'", request.getUserId(), request.getKind(), request.getName());
        return execute("Relationship query", () ->
            queryOrchestrator.executeRelationshipQuery(request.getKind(), request.getName(), request.getUserId()));
    }

    private ResponseEntity<QueryResponse> execute(String operation, Supplier<QueryResult> call) {
        try {
            return ResponseEntity.ok(QueryResponse.success(call.get()));

        } catch (QueryValidationException e) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return ResponseEntity.badRequest()
                .body(QueryResponse.error(e.getMessage()));

        } catch (QueryTimeoutException e) {
            log.warn("{} timed out: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT)
                .body(QueryResponse.error(e.getMessage()));

        } catch (CollaboratorUnavailableException e) {
            log.error("{} failed, {} unavailable: {}", operation, e.getService().getName(), e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(QueryResponse.error(e.getService().getName() + " unavailable: " + e.getMessage()));

        } catch (Exception e) {
            log.error("{} failed", operation, e);
            return ResponseEntity.internalServerError()
                .body(QueryResponse.error(operation + " failed: " + e.getMessage()));
        }
    }
}
