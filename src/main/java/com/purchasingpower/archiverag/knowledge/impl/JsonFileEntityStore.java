package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.configuration.EntityStoreProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.DecisionItem;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.knowledge.EntityStore;
import com.purchasingpower.archiverag.model.CallContext;
import com.purchasingpower.archiverag.model.ServiceType;
import com.purchasingpower.archiverag.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Read-only entity store over a directory of JSON files, one {@code <uuid>.json} per entity:
 *
 * <pre>
 * entities/
 *   people/      {"id", "display_name", "alias"}
 *   workgroups/  {"id", "name"}
 *   topics/      {"id", "name"}
 *   meetings/    {"id", "workgroup_id", "date", "purpose", "participant_ids", "topics", "decisions"}
 * </pre>
 *
 * Unreadable single files are skipped; an unreadable store is reported as unavailable.
 */
@Slf4j
@Component
public class JsonFileEntityStore implements EntityStore {

    private final ObjectMapper objectMapper;
    private final EntityStoreProperties properties;
    private final Path baseDirectory;

    public JsonFileEntityStore(ObjectMapper objectMapper, AppProperties appProperties) {
        this.objectMapper = objectMapper;
        this.properties = appProperties.getEntityStore();
        this.baseDirectory = Paths.get(properties.getBaseDirectory());
    }

    @Override
    public List<CanonicalEntity> listEntities(EntityKind kind) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.ENTITY_STORE, "listEntities", log);
        ctx.logRequest(kind.name());

        List<CanonicalEntity> entities = new ArrayList<>();
        for (Path file : jsonFiles(directoryFor(kind), ctx)) {
            readJson(file).map(node -> toEntity(kind, node, file)).ifPresent(entities::add);
        }

        ctx.logResponse(entities.size() + " " + kind.name().toLowerCase() + " entities");
        return entities;
    }

    @Override
    public Optional<CanonicalEntity> getEntity(EntityKind kind, UUID id) {
        Path file = directoryFor(kind).resolve(id + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return readJson(file).map(node -> toEntity(kind, node, file));
    }

    @Override
    public List<MeetingRecord> listMeetings() {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.ENTITY_STORE, "listMeetings", log);
        ctx.logRequest(null);

        List<MeetingRecord> meetings = new ArrayList<>();
        for (Path file : jsonFiles(meetingsDirectory(), ctx)) {
            readJson(file).map(node -> toMeeting(node, file)).ifPresent(meetings::add);
        }

        ctx.logResponse(meetings.size() + " meetings");
        return meetings;
    }

    @Override
    public Optional<MeetingRecord> getMeeting(UUID id) {
        Path file = meetingsDirectory().resolve(id + ".json");
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return readJson(file).map(node -> toMeeting(node, file));
    }

    private Path directoryFor(EntityKind kind) {
        String sub = switch (kind) {
            case PERSON -> properties.getPeopleDirectory();
            case WORKGROUP -> properties.getWorkgroupsDirectory();
            case TOPIC -> properties.getTopicsDirectory();
        };
        return baseDirectory.resolve(sub);
    }

    private Path meetingsDirectory() {
        return baseDirectory.resolve(properties.getMeetingsDirectory());
    }

    private List<Path> jsonFiles(Path directory, CallContext ctx) {
        if (!Files.isDirectory(baseDirectory)) {
            ctx.logError("Entity store directory not found: " + baseDirectory.toAbsolutePath(), null);
            throw new CollaboratorUnavailableException(ServiceType.ENTITY_STORE,
                "Entity store directory not found: " + baseDirectory.toAbsolutePath());
        }
        if (!Files.isDirectory(directory)) {
            log.warn("⚠️ Entity directory missing, treating as empty: {}", directory);
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files
                .filter(p -> p.getFileName().toString().endsWith(".json"))
                .sorted()
                .toList();
        } catch (IOException e) {
            ctx.logError(e.getMessage(), e);
            throw new CollaboratorUnavailableException(ServiceType.ENTITY_STORE,
                "Cannot list entity directory " + directory, e);
        }
    }

    private Optional<JsonNode> readJson(Path file) {
        try {
            return Optional.of(objectMapper.readTree(file.toFile()));
        } catch (IOException e) {
            log.warn("⚠️ Skipping unreadable entity file {}: {}", file.getFileName(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @return null when the entity has no usable id
     */
    private CanonicalEntity toEntity(EntityKind kind, JsonNode node, Path file) {
        Optional<UUID> id = uuid(node.get("id")).or(() -> idFromFileName(file));
        if (id.isEmpty()) {
            log.warn("⚠️ Skipping entity file without a valid id: {}", file.getFileName());
            return null;
        }
        String displayName = firstText(node, "display_name", "displayName", "name");

        List<String> alternates = new ArrayList<>();
        for (String field : List.of("alternate_names", "alternateNames", "aliases")) {
            JsonNode values = node.get(field);
            if (values != null && values.isArray()) {
                values.forEach(v -> alternates.add(v.asText()));
            }
        }
        String alias = firstText(node, "alias");
        if (alias != null) {
            alternates.add(alias);
        }

        return CanonicalEntity.builder()
            .id(id.get())
            .displayName(displayName)
            .kind(kind)
            .alternateNames(alternates)
            .build();
    }

    /**
     * @return null when the meeting has no usable id
     */
    private MeetingRecord toMeeting(JsonNode node, Path file) {
        Optional<UUID> id = uuid(node.get("id")).or(() -> idFromFileName(file));
        if (id.isEmpty()) {
            log.warn("⚠️ Skipping meeting file without a valid id: {}", file.getFileName());
            return null;
        }

        List<UUID> participants = new ArrayList<>();
        for (String field : List.of("participant_ids", "participantIds", "participants")) {
            JsonNode values = node.get(field);
            if (values != null && values.isArray()) {
                values.forEach(v -> uuid(v).ifPresent(participants::add));
            }
        }

        List<String> topics = new ArrayList<>();
        JsonNode topicNodes = node.get("topics");
        if (topicNodes != null && topicNodes.isArray()) {
            topicNodes.forEach(t -> {
                String topic = t.isObject() ? firstText(t, "name", "topic") : t.asText();
                if (topic != null && !topic.isBlank()) {
                    topics.add(topic);
                }
            });
        }

        List<DecisionItem> decisions = new ArrayList<>();
        JsonNode decisionNodes = node.get("decisions");
        if (decisionNodes != null && decisionNodes.isArray()) {
            decisionNodes.forEach(d -> decisions.add(d.isObject()
                ? new DecisionItem(firstText(d, "decision"), firstText(d, "rationale"), firstText(d, "effect"))
                : new DecisionItem(d.asText(), null, null)));
        }

        return MeetingRecord.builder()
            .id(id.get())
            .workgroupId(uuid(firstNode(node, "workgroup_id", "workgroupId")).orElse(null))
            .date(date(firstText(node, "date")))
            .purpose(firstText(node, "purpose"))
            .participantIds(participants)
            .topics(topics)
            .decisions(decisions)
            .build();
    }

    private static Optional<UUID> idFromFileName(Path file) {
        String name = file.getFileName().toString();
        String stem = name.endsWith(".json") ? name.substring(0, name.length() - ".json".length()) : name;
        return uuid(new TextNode(stem));
    }

    private static Optional<UUID> uuid(JsonNode node) {
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(UUID.fromString(node.asText().trim()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private static LocalDate date(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String datePart = value.contains("T") ? value.substring(0, value.indexOf('T')) : value.trim();
        try {
            return LocalDate.parse(datePart);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable meeting date '{}'", value);
            return null;
        }
    }

    private static JsonNode firstNode(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String firstText(JsonNode node, String... fields) {
        JsonNode value = firstNode(node, fields);
        if (value == null) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
