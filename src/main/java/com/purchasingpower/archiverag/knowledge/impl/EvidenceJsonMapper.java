package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.purchasingpower.archiverag.core.ChunkEntity;
import com.purchasingpower.archiverag.core.ChunkRelationship;
import com.purchasingpower.archiverag.core.EvidenceItem;
import com.purchasingpower.archiverag.core.ExtractionMetadata;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps search-service JSON into {@link EvidenceItem}s.
 *
 * <p>Accepts a bare array or an object with a {@code results} array. Each result:
 * <pre>
 * {"meeting_id": "...", "text": "...", "score": 0.82,
 *  "metadata": {"date": "2025-03-04", "workgroup": "Archives Workgroup",
 *               "chunk_type": "decision_record",
 *               "chunk_entities": [{"entity_id", "entity_type", "normalized_name", "mentions"}],
 *               "relationships": [{"subject", "relationship", "object"}]}}
 * </pre>
 */
@Slf4j
public final class EvidenceJsonMapper {

    private EvidenceJsonMapper() {
    }

    public static List<EvidenceItem> toEvidence(JsonNode root) {
        JsonNode results = root != null && root.isObject() ? root.get("results") : root;
        List<EvidenceItem> items = new ArrayList<>();
        if (results == null || !results.isArray()) {
            return items;
        }
        for (JsonNode result : results) {
            items.add(toItem(result));
        }
        return items;
    }

    static EvidenceItem toItem(JsonNode result) {
        JsonNode metadata = result.path("metadata");

        String recordId = text(result, "meeting_id", "record_id");
        if (recordId == null) {
            recordId = text(metadata, "meeting_id", "record_id");
        }
        String excerpt = text(result, "text", "excerpt");
        String groupingName = text(metadata, "workgroup", "workgroup_name");
        LocalDate date = date(text(metadata, "date") != null ? text(metadata, "date") : text(result, "date"));

        return EvidenceItem.builder()
            .recordId(recordId)
            .date(date)
            .excerpt(excerpt != null ? excerpt : "")
            .score(result.path("score").asDouble(0.0))
            .groupingName(groupingName)
            .extraction(extraction(metadata))
            .build();
    }

    private static ExtractionMetadata extraction(JsonNode metadata) {
        if (metadata.isMissingNode() || metadata.isNull()) {
            return ExtractionMetadata.absent();
        }
        String chunkType = text(metadata, "chunk_type");

        List<ChunkEntity> entities = new ArrayList<>();
        JsonNode entityNodes = metadata.path("chunk_entities");
        if (entityNodes.isArray()) {
            for (JsonNode e : entityNodes) {
                List<String> mentions = new ArrayList<>();
                e.path("mentions").forEach(m -> mentions.add(m.asText()));
                entities.add(ChunkEntity.builder()
                    .entityId(text(e, "entity_id"))
                    .entityType(text(e, "entity_type"))
                    .normalizedName(text(e, "normalized_name"))
                    .mentions(mentions)
                    .build());
            }
        }

        List<ChunkRelationship> relationships = new ArrayList<>();
        JsonNode relationshipNodes = metadata.path("relationships");
        if (relationshipNodes.isArray()) {
            for (JsonNode r : relationshipNodes) {
                relationships.add(new ChunkRelationship(
                    text(r, "subject"), text(r, "relationship"), text(r, "object")));
            }
        }

        if (chunkType == null && entities.isEmpty() && relationships.isEmpty()) {
            return ExtractionMetadata.absent();
        }
        return ExtractionMetadata.of(chunkType, entities, relationships);
    }

    private static LocalDate date(String value) {
        if (value == null) {
            return null;
        }
        String datePart = value.contains("T") ? value.substring(0, value.indexOf('T')) : value.trim();
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable evidence date '{}'", value);
            return null;
        }
    }

    private static String text(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }
}
