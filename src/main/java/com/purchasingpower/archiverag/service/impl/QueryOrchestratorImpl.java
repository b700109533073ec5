package com.purchasingpower.archiverag.service.impl;

import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.configuration.QueryProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.IntentType;
import com.purchasingpower.archiverag.core.Query;
import com.purchasingpower.archiverag.core.QueryOutcome;
import com.purchasingpower.archiverag.core.QueryResult;
import com.purchasingpower.archiverag.core.RelationshipSubject;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.exception.QueryTimeoutException;
import com.purchasingpower.archiverag.exception.QueryValidationException;
import com.purchasingpower.archiverag.filter.QueryParser;
import com.purchasingpower.archiverag.intent.IntentClassifier;
import com.purchasingpower.archiverag.intent.IntentDecision;
import com.purchasingpower.archiverag.knowledge.AuditSink;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import com.purchasingpower.archiverag.model.audit.AuditRecord;
import com.purchasingpower.archiverag.service.QueryOrchestrator;
import com.purchasingpower.archiverag.service.handler.HandlerResult;
import com.purchasingpower.archiverag.service.handler.QueryHandler;
import com.purchasingpower.archiverag.service.handler.RelationshipQueryHandler;
import com.purchasingpower.archiverag.util.QueryInputValidator;
import com.purchasingpower.archiverag.verification.EvidenceGate;
import com.purchasingpower.archiverag.verification.GateDecision;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs a question through classification, the chosen handler and the evidence gate,
 * then records it in the audit trail.
 *
 * <p>Handlers run on the {@code queryExecutor} pool and the caller waits at most
 * {@code app.query.timeout-seconds}; a timed-out handler thread is interrupted.
 * Unreachable collaborators surface as {@link CollaboratorUnavailableException};
 * any other failure becomes a safe {@link QueryOutcome#ERROR} result with no evidence.
 */
@Slf4j
@Service
public class QueryOrchestratorImpl implements QueryOrchestrator {

    public static final String ERROR_MESSAGE =
        "An error occurred while answering this question. No evidence-based answer is available.";
    public static final String ERROR_MODEL = "none";

    private final QueryParser queryParser;
    private final IntentClassifier intentClassifier;
    private final EntityStore entityStore;
    private final Map<IntentType, QueryHandler> handlers = new EnumMap<>(IntentType.class);
    private final RelationshipQueryHandler relationshipHandler;
    private final EvidenceGate evidenceGate;
    private final AuditSink auditSink;
    private final Executor queryExecutor;
    private final QueryProperties properties;
    private final Clock clock;

    public QueryOrchestratorImpl(QueryParser queryParser,
                                 IntentClassifier intentClassifier,
                                 EntityStore entityStore,
                                 List<QueryHandler> queryHandlers,
                                 RelationshipQueryHandler relationshipHandler,
                                 EvidenceGate evidenceGate,
                                 AuditSink auditSink,
                                 @Qualifier("queryExecutor") Executor queryExecutor,
                                 AppProperties appProperties,
                                 Clock clock) {
        this.queryParser = queryParser;
        this.intentClassifier = intentClassifier;
        this.entityStore = entityStore;
        this.relationshipHandler = relationshipHandler;
        this.evidenceGate = evidenceGate;
        this.auditSink = auditSink;
        this.queryExecutor = queryExecutor;
        this.properties = appProperties.getQuery();
        this.clock = clock;
        queryHandlers.forEach(handler -> handlers.put(handler.intent(), handler));
        if (!handlers.containsKey(IntentType.GENERIC)) {
            throw new IllegalStateException("No handler registered for " + IntentType.GENERIC);
        }
    }

    @Override
    public QueryResult executeQuery(String text, String callerId) {
        String validated = QueryInputValidator.validate(text, properties.getMinLength());
        String queryId = UUID.randomUUID().toString();
        log.info("❓ Query {} from {}: {}", queryId, callerId != null ? callerId : "anonymous", validated);

        QueryResult result = runWithTimeout(queryId, validated, callerId, () -> answer(queryId, validated, callerId));
        return audit(result);
    }

    @Override
    public QueryResult executeRelationshipQuery(String kind, String name, String callerId) {
        RelationshipSubject subject = RelationshipSubject.parse(kind)
            .orElseThrow(() -> new QueryValidationException(
                "Relationship kind must be one of person, workgroup or meeting", kind));
        String validated = QueryInputValidator.validate(name, 1);
        String queryId = UUID.randomUUID().toString();
        String userInput = subject.name().toLowerCase() + ": " + validated;
        log.info("🔗 Relationship query {} from {}: {}", queryId, callerId != null ? callerId : "anonymous", userInput);

        QueryResult result = runWithTimeout(queryId, userInput, callerId, () ->
            gate(queryId, userInput, callerId, IntentType.RELATIONSHIP, relationshipHandler.handle(subject, validated)));
        return audit(result);
    }

    private QueryResult answer(String queryId, String text, String callerId) {
        Query query = queryParser.parse(text, callerId);
        IntentDecision decision = intentClassifier.classify(text, groupingNames());
        QueryHandler handler = handlers.getOrDefault(decision.getIntent(), handlers.get(IntentType.GENERIC));
        HandlerResult candidate = handler.handle(query);
        return gate(queryId, text, callerId, decision.getIntent(), candidate);
    }

    private Collection<String> groupingNames() {
        return entityStore.listEntities(EntityKind.WORKGROUP).stream()
            .flatMap(workgroup -> workgroup.allNames().stream())
            .toList();
    }

    private QueryResult gate(String queryId, String text, String callerId, IntentType intent, HandlerResult candidate) {
        GateDecision decision = candidate.isEvidenceAvailable()
            ? evidenceGate.decide(candidate.getAnswer(), candidate.getCitations(),
                candidate.isRequireEntityExtraction(), candidate.isGenerated())
            : evidenceGate.noEvidence(candidate.getAnswer(), candidate.getNoEvidenceReason());

        return QueryResult.builder()
            .queryId(queryId)
            .userInput(text)
            .userId(callerId)
            .answer(decision.getAnswer())
            .citations(decision.getCitations())
            .evidenceFound(decision.isEvidenceFound())
            .intent(intent)
            .seed(properties.getSeed())
            .modelVersion(candidate.getModelVersion())
            .timestamp(Instant.now(clock))
            .outcome(decision.getOutcome())
            .failure(decision.getFailure())
            .build();
    }

    private QueryResult runWithTimeout(String queryId, String text, String callerId, Supplier<QueryResult> task) {
        // cancel(true) on a FutureTask interrupts the handler thread
        FutureTask<QueryResult> future = new FutureTask<>(task::get);
        queryExecutor.execute(future);
        try {
            return future.get(properties.getTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.error("⏱️ Query {} timed out after {}s", queryId, properties.getTimeoutSeconds());
            throw new QueryTimeoutException(queryId, properties.getTimeoutSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CollaboratorUnavailableException unavailable) {
                log.error("❌ Query {} failed: {} unavailable: {}",
                    queryId, unavailable.getService().getName(), unavailable.getMessage());
                throw unavailable;
            }
            log.error("❌ Query {} failed, returning safe default: {}", queryId, cause.getMessage(), cause);
            return safeDefault(queryId, text, callerId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.error("❌ Query {} interrupted, returning safe default", queryId, e);
            return safeDefault(queryId, text, callerId);
        }
    }

    private QueryResult safeDefault(String queryId, String text, String callerId) {
        return QueryResult.builder()
            .queryId(queryId)
            .userInput(text)
            .userId(callerId)
            .answer(ERROR_MESSAGE)
            .citations(List.of(Citation.noEvidence("Processing error")))
            .evidenceFound(false)
            .seed(properties.getSeed())
            .modelVersion(ERROR_MODEL)
            .timestamp(Instant.now(clock))
            .outcome(QueryOutcome.ERROR)
            .build();
    }

    private QueryResult audit(QueryResult result) {
        try {
            Path path = auditSink.append(result.getQueryId(), AuditRecord.from(result));
            log.info("✅ Query {} {} (evidence: {}, citations: {}, audit: {})",
                result.getQueryId(), result.getOutcome(), result.isEvidenceFound(),
                result.getCitations().size(), path);
            return result.toBuilder().auditRecordPath(path.toString()).build();
        } catch (RuntimeException e) {
            log.error("❌ Audit write failed for query {}: {}", result.getQueryId(), e.getMessage(), e);
            return result;
        }
    }
}
