package com.purchasingpower.archiverag.verification;

import com.purchasingpower.archiverag.core.ChunkRelationship;
import com.purchasingpower.archiverag.core.Citation;
import com.purchasingpower.archiverag.core.ExtractionMetadata;
import com.purchasingpower.archiverag.core.RecordIds;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Citation Verifier Tests")
class CitationVerifierTest {

    private final CitationVerifier verifier = new CitationVerifier();

    private static Citation citation(String recordId, ExtractionMetadata extraction) {
        return Citation.builder()
            .recordId(recordId)
            .date("2025-03-04")
            .groupingName("Archives Workgroup")
            .excerpt("Decided to adopt the tag taxonomy")
            .extraction(extraction)
            .build();
    }

    @Test
    @DisplayName("No citations fails with missing citations")
    void emptyCitations_ShouldFail() {
        VerificationResult result = verifier.verify(List.of(), false);

        assertThat(result.isVerified()).isFalse();
        assertThat(result.getFailure()).isEqualTo(VerificationFailure.MISSING_CITATIONS);
        assertThat(result.getMessage()).startsWith("No citations found");
    }

    @Test
    @DisplayName("Only sentinel ids fail with invalid citations")
    void sentinelOnly_ShouldFailAsInvalid() {
        List<Citation> citations = List.of(
            citation(RecordIds.ENTITY_STORAGE, ExtractionMetadata.absent()),
            citation(RecordIds.QUANTITATIVE_ANALYSIS, ExtractionMetadata.absent()));

        VerificationResult result = verifier.verify(citations, false);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.INVALID_CITATIONS);
        assertThat(result.getCitationCount()).isEqualTo(2);
        assertThat(result.getValidCitationCount()).isZero();
    }

    @Test
    @DisplayName("Malformed ids are not valid record references")
    void malformedIds_ShouldFailAsInvalid() {
        VerificationResult result = verifier.verify(List.of(
            citation("meeting-42", ExtractionMetadata.ofChunkType("meeting_summary")),
            citation("1-1-1-1-1", ExtractionMetadata.ofChunkType("meeting_summary"))), false);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.INVALID_CITATIONS);
    }

    @Test
    @DisplayName("Invalid ids are reported before missing extraction")
    void invalidBeforeExtraction() {
        VerificationResult result = verifier.verify(
            List.of(citation(RecordIds.NO_EVIDENCE, ExtractionMetadata.absent())), true);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.INVALID_CITATIONS);
    }

    @Test
    @DisplayName("Valid ids without extraction fail when extraction is required")
    void missingExtraction_ShouldFailWhenRequired() {
        List<Citation> citations = List.of(citation(UUID.randomUUID().toString(), ExtractionMetadata.absent()));

        assertThat(verifier.verify(citations, true).getFailure())
            .isEqualTo(VerificationFailure.MISSING_ENTITY_EXTRACTION);
        assertThat(verifier.verify(citations, false).isVerified()).isTrue();
    }

    @Test
    @DisplayName("Relationships alone are not extraction metadata")
    void relationshipsOnly_ShouldNotCountAsExtraction() {
        ExtractionMetadata relationshipsOnly = ExtractionMetadata.of(null, List.of(),
            List.of(new ChunkRelationship("Stephen", "ATTENDED", "Meeting")));

        VerificationResult result = verifier.verify(
            List.of(citation(UUID.randomUUID().toString(), relationshipsOnly)), true);

        assertThat(result.getFailure()).isEqualTo(VerificationFailure.MISSING_ENTITY_EXTRACTION);
    }

    @Test
    @DisplayName("One valid citation with extraction is enough")
    void validCitation_ShouldPass() {
        List<Citation> citations = List.of(
            citation(RecordIds.NO_EVIDENCE, ExtractionMetadata.absent()),
            citation(UUID.randomUUID().toString(), ExtractionMetadata.ofChunkType("decision_record")));

        VerificationResult result = verifier.verify(citations, true);

        assertThat(result.isVerified()).isTrue();
        assertThat(result.getFailure()).isNull();
        assertThat(result.getCitationCount()).isEqualTo(2);
        assertThat(result.getValidCitationCount()).isEqualTo(1);
        assertThat(result.getMessage()).isEmpty();
    }

    @Test
    @DisplayName("Valid count includes valid citations lacking extraction")
    void mixedExtraction_ShouldReportAllValidCitations() {
        // Given
        List<Citation> citations = List.of(
            citation(UUID.randomUUID().toString(), ExtractionMetadata.ofChunkType("decision_record")),
            citation(UUID.randomUUID().toString(), ExtractionMetadata.absent()),
            citation(RecordIds.NO_EVIDENCE, ExtractionMetadata.absent()));

        // When
        VerificationResult result = verifier.verify(citations, true);

        // Then
        assertThat(result.isVerified()).isTrue();
        assertThat(result.getCitationCount()).isEqualTo(3);
        assertThat(result.getValidCitationCount()).isEqualTo(2);
    }
}
