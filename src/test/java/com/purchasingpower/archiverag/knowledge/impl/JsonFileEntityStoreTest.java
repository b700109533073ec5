package com.purchasingpower.archiverag.knowledge.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.archiverag.configuration.AppProperties;
import com.purchasingpower.archiverag.core.CanonicalEntity;
import com.purchasingpower.archiverag.core.EntityKind;
import com.purchasingpower.archiverag.core.MeetingRecord;
import com.purchasingpower.archiverag.exception.CollaboratorUnavailableException;
import com.purchasingpower.archiverag.model.ServiceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JSON File Entity Store Tests")
class JsonFileEntityStoreTest {

    private static final String STEPHEN = "6f1c1a52-7d0f-4b8e-9a36-2f5f3b0c9e11";
    private static final String ARCHIVES = "a3e2b9c4-1d5f-4e6a-8b7c-9d0e1f2a3b4c";
    private static final String MEETING = "c0ffee00-1234-4abc-9def-0123456789ab";

    @TempDir
    Path baseDir;

    private JsonFileEntityStore store;

    @BeforeEach
    void setUp() throws IOException {
        AppProperties properties = new AppProperties();
        properties.getEntityStore().setBaseDirectory(baseDir.toString());
        store = new JsonFileEntityStore(new ObjectMapper(), properties);

        write("people/" + STEPHEN + ".json",
            "{\"id\": \"" + STEPHEN + "\", \"display_name\": \"Stephen\", \"alias\": \"Stephen [QADAO]\"}");
        write("workgroups/" + ARCHIVES + ".json",
            "{\"id\": \"" + ARCHIVES + "\", \"name\": \"Archives Workgroup\", \"alternate_names\": [\"Archive WG\"]}");
        write("meetings/" + MEETING + ".json", """
            {
              "workgroup_id": "%s",
              "date": "2025-03-04T10:00:00Z",
              "purpose": "Monthly sync",
              "participant_ids": ["%s", "not-a-uuid"],
              "topics": ["Tag taxonomy", {"name": "Budget"}],
              "decisions": [{"decision": "Adopt the taxonomy", "rationale": "Consistency"}, "Publish reports"]
            }
            """.formatted(ARCHIVES, STEPHEN));
    }

    private void write(String relative, String content) throws IOException {
        Path file = baseDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    @Test
    @DisplayName("Should read entities with display and alternate names")
    void listEntities_ShouldReadNames() {
        List<CanonicalEntity> people = store.listEntities(EntityKind.PERSON);
        List<CanonicalEntity> workgroups = store.listEntities(EntityKind.WORKGROUP);

        assertThat(people).singleElement().satisfies(p -> {
            assertThat(p.getId()).isEqualTo(UUID.fromString(STEPHEN));
            assertThat(p.getDisplayName()).isEqualTo("Stephen");
            assertThat(p.getAlternateNames()).containsExactly("Stephen [QADAO]");
            assertThat(p.getKind()).isEqualTo(EntityKind.PERSON);
        });
        assertThat(workgroups.get(0).allNames()).containsExactly("Archives Workgroup", "Archive WG");
    }

    @Test
    @DisplayName("Should read meetings, taking the id from the file name")
    void getMeeting_ShouldReadAllFields() {
        MeetingRecord meeting = store.getMeeting(UUID.fromString(MEETING)).orElseThrow();

        assertThat(meeting.getId()).isEqualTo(UUID.fromString(MEETING));
        assertThat(meeting.getWorkgroupId()).isEqualTo(UUID.fromString(ARCHIVES));
        assertThat(meeting.getDate()).isEqualTo(LocalDate.of(2025, 3, 4));
        assertThat(meeting.getParticipantIds()).containsExactly(UUID.fromString(STEPHEN));
        assertThat(meeting.getTopics()).containsExactly("Tag taxonomy", "Budget");
        assertThat(meeting.getDecisions()).hasSize(2);
        assertThat(meeting.getDecisions().get(0).getRationale()).isEqualTo("Consistency");
        assertThat(meeting.getDecisions().get(1).getDecision()).isEqualTo("Publish reports");
    }

    @Test
    @DisplayName("Unknown ids and missing directories are empty results")
    void missingData_ShouldBeEmpty() {
        assertThat(store.getEntity(EntityKind.PERSON, UUID.randomUUID())).isEmpty();
        assertThat(store.listEntities(EntityKind.TOPIC)).isEmpty();
    }

    @Test
    @DisplayName("Broken files and files without an id are skipped")
    void brokenFiles_ShouldBeSkipped() throws IOException {
        write("people/broken.json", "{ not json");
        write("people/nameless.json", "{\"display_name\": \"Ghost\"}");

        assertThat(store.listEntities(EntityKind.PERSON)).extracting(CanonicalEntity::getDisplayName)
            .containsExactly("Stephen");
    }

    @Test
    @DisplayName("A missing store directory is reported as unavailable")
    void missingBaseDirectory_ShouldBeUnavailable() {
        AppProperties properties = new AppProperties();
        properties.getEntityStore().setBaseDirectory(baseDir.resolve("nowhere").toString());
        JsonFileEntityStore missing = new JsonFileEntityStore(new ObjectMapper(), properties);

        assertThatThrownBy(missing::listMeetings)
            .isInstanceOf(CollaboratorUnavailableException.class)
            .satisfies(e -> assertThat(((CollaboratorUnavailableException) e).getService())
                .isEqualTo(ServiceType.ENTITY_STORE));
    }
}
