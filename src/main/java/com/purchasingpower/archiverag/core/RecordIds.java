package com.purchasingpower.archiverag.core;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Record identifier rules shared by filters, citations and the verifier.
 *
 * <p>A real record id is a well-formed UUID. Sentinel ids mark citations that
 * document a data source or the absence of evidence rather than a meeting record.
 */
public final class RecordIds {

    public static final String NO_EVIDENCE = "no-evidence";
    public static final String ENTITY_STORAGE = "entity-storage";
    public static final String QUANTITATIVE_ANALYSIS = "quantitative-analysis";

    private static final Set<String> SENTINELS = Set.of(NO_EVIDENCE, ENTITY_STORAGE, QUANTITATIVE_ANALYSIS);

    private static final Pattern URN_PREFIX = Pattern.compile("^(?:urn:)?(?:uuid:)?", Pattern.CASE_INSENSITIVE);
    private static final Pattern HEX_32 = Pattern.compile("[0-9a-fA-F]{32}");

    private RecordIds() {
    }

    public static boolean isSentinel(String recordId) {
        return recordId != null && SENTINELS.contains(recordId.trim().toLowerCase());
    }

    /**
     * Parses a record id into its canonical UUID form.
     *
     * <p>Accepts the textual forms one identifier may take: hyphenated or bare 32 hex
     * digits, any case, optionally braced or prefixed with {@code urn:uuid:}.
     */
    public static Optional<UUID> canonical(String recordId) {
        if (recordId == null || isSentinel(recordId)) {
            return Optional.empty();
        }
        String hex = URN_PREFIX.matcher(recordId.trim()).replaceFirst("");
        if (hex.startsWith("{") && hex.endsWith("}")) {
            hex = hex.substring(1, hex.length() - 1);
        }
        hex = hex.replace("-", "");
        if (!HEX_32.matcher(hex).matches()) {
            return Optional.empty();
        }
        return Optional.of(new UUID(
            Long.parseUnsignedLong(hex.substring(0, 16), 16),
            Long.parseUnsignedLong(hex.substring(16), 16)));
    }

    public static boolean isValidRecord(String recordId) {
        return canonical(recordId).isPresent();
    }

    /**
     * Compares two ids in canonical form, so case or formatting differences do not matter.
     */
    public static boolean sameRecord(String recordId, UUID expected) {
        return expected != null && canonical(recordId).map(expected::equals).orElse(false);
    }
}
