package com.purchasingpower.archiverag.quantitative;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.model.CallContext;
import com.purchasingpower.archiverag.model.ServiceType;
import com.purchasingpower.archiverag.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Fetches a meeting source JSON document (e.g. a raw GitHub file) over HTTP.
 */
@Slf4j
@Component
public class HttpMeetingSource implements MeetingSource {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public HttpMeetingSource(AppProperties appProperties, ObjectMapper objectMapper) {
        this.timeout = Duration.ofSeconds(appProperties.getQuantitative().getSourceTimeoutSeconds());
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public SourceCount count(String url) {
        Preconditions.checkNotNull(url, "Source URL cannot be null");
        Preconditions.checkArgument(!url.isBlank(), "Source URL cannot be empty");

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.SOURCE_URL, "countMeetings", log);
        ctx.logRequest(url);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .header("Accept", "application/json")
                    .timeout(timeout)
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

            if (response.statusCode() != 200) {
                ctx.logError("HTTP " + response.statusCode(), null);
                throw new CollaboratorUnavailableException(ServiceType.SOURCE_URL,
                    "Meeting source returned HTTP " + response.statusCode() + ": " + url);
            }

            JsonNode root = objectMapper.readTree(response.body());
            SourceCount count = SourceCount.from(url, root);
            ctx.logResponse(String.format("%d items, %d unique meetings", count.getTotal(), count.getUnique()));
            return count;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ctx.logError("Interrupted", e);
            throw new CollaboratorUnavailableException(ServiceType.SOURCE_URL, "Interrupted fetching " + url, e);
        } catch (IOException | IllegalArgumentException e) {
            ctx.logError(e.getMessage(), e);
            throw new CollaboratorUnavailableException(ServiceType.SOURCE_URL,
                "Failed to count meetings from source URL " + url + ": " + e.getMessage(), e);
        }
    }
}
