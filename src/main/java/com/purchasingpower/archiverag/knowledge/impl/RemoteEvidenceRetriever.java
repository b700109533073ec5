package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.configuration.RetrievalProperties;
import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.knowledge.EvidenceRetriever;
import com.purchasingpower.archiverag.model.CallContext;
import com.purchasingpower.archiverag.model.ServiceType;
import com.purchasingpower.archiverag.util.ExternalCallLogger;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Evidence search against the remote vector search service.
 */
@Slf4j
@Component
public class RemoteEvidenceRetriever implements EvidenceRetriever {

    private final RetrievalProperties properties;
    private final WebClient webClient;

    public RemoteEvidenceRetriever(AppProperties appProperties) {
        this.properties = appProperties.getRetrieval();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()));

        this.webClient = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public List<EvidenceItem> search(String queryText, int topK) {
        Preconditions.checkNotNull(queryText, "Query cannot be null");
        Preconditions.checkArgument(topK > 0, "topK must be positive: %s", topK);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.VECTOR_INDEX, "search", log);
        ctx.logRequest(ExternalCallLogger.truncate(queryText, 200), "topK", topK);

        Map<String, Object> body = Map.of("query", queryText, "top_k", topK);

        try {
            JsonNode response = webClient.post()
                    .uri(properties.getSearchPath())
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(properties.getTimeoutSeconds()));

            List<EvidenceItem> evidence = EvidenceJsonMapper.toEvidence(response);
            ctx.logResponse(evidence.size() + " evidence items");
            return evidence;

        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new CollaboratorUnavailableException(ServiceType.VECTOR_INDEX,
                "Evidence search failed at " + properties.getBaseUrl() + ": " + e.getMessage(), e);
        }
    }
}
