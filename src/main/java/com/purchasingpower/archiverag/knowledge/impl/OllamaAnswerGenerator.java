package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.configuration.GenerationProperties;
import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.knowledge.AnswerGenerator;
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
 * Answer generation through an Ollama-compatible {@code /api/chat} endpoint.
 * Temperature and seed are fixed so the same evidence gives the same answer.
 */
@Slf4j
@Component
public class OllamaAnswerGenerator implements AnswerGenerator {

    private static final String SYSTEM_PROMPT =
        "You answer questions about archived meetings using only the meeting records provided. "
            + "Name the workgroup and date of every meeting you use. "
            + "If the records do not contain the answer, say that the topic was not mentioned.";

    private final GenerationProperties properties;
    private final long seed;
    private final WebClient webClient;

    public OllamaAnswerGenerator(AppProperties appProperties) {
        this.properties = appProperties.getGeneration();
        this.seed = appProperties.getQuery().getSeed();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(Duration.ofSeconds(properties.getTimeoutSeconds()));

        this.webClient = WebClient.builder()
                .baseUrl(properties.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }

    @Override
    public String generate(String queryText, List<EvidenceItem> evidence) {
        String prompt = buildPrompt(queryText, evidence);

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.LLM, "chat", log);
        ctx.logRequest(ExternalCallLogger.truncate(prompt, 200), "model", properties.getModel(), "evidence", evidence.size());

        Map<String, Object> body = Map.of(
                "model", properties.getModel(),
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", prompt)
                ),
                "stream", false,
                "options", Map.of(
                        "temperature", properties.getTemperature(),
                        "seed", seed
                )
        );

        try {
            JsonNode response = webClient.post()
                    .uri("/api/chat")
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(Duration.ofSeconds(properties.getTimeoutSeconds()));

            String content = response == null ? "" : response.path("message").path("content").asText("");
            ctx.logResponse(ExternalCallLogger.truncate(content, 500));
            return content;

        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new CollaboratorUnavailableException(ServiceType.LLM,
                "Answer generation failed with model " + properties.getModel() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String modelVersion() {
        return properties.getModel();
    }

    static String buildPrompt(String queryText, List<EvidenceItem> evidence) {
        StringBuilder context = new StringBuilder();
        for (EvidenceItem item : evidence) {
            String workgroup = item.getGroupingName() != null ? item.getGroupingName() : "Unknown Workgroup";
            String date = item.getDate() != null ? item.getDate().toString() : "Unknown Date";
            context.append("[Meeting: ").append(item.getRecordId())
                .append(" | ").append(workgroup).append(" - ").append(date).append("]\n")
                .append(item.getExcerpt())
                .append("\n\n");
        }
        return "Based on the following meeting records, answer the question.\n\n"
            + context
            + "Question: " + queryText + "\n\nAnswer:";
    }
}
