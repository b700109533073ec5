package com.purchasingpower.archiverag.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The single authoritative identity a name variation resolves to.
 *
 * <p>Owned by the entity store. The resolver reads these but never creates or deletes them.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CanonicalEntity {

    private UUID id;
    private String displayName;
    private EntityKind kind;

    /**
     * Known spellings other than the display name (aliases, old handles).
     */
    @Builder.Default
    private List<String> alternateNames = new ArrayList<>();

    /**
     * Display name first, then alternates, skipping blanks.
     */
    public List<String> allNames() {
        List<String> names = new ArrayList<>();
        if (displayName != null && !displayName.isBlank()) {
            names.add(displayName);
        }
        if (alternateNames != null) {
            alternateNames.stream()
                .filter(n -> n != null && !n.isBlank())
                .forEach(names::add);
        }
        return names;
    }
}
