package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Entity resolution settings, bound from {@code app.resolver}.
 *
 * <pre>
 * app:
 *   resolver:
 *     similarity-threshold: 0.8
 *     enable-fuzzy-matching: true
 *     enable-context-disambiguation: true
 *     affinity-increment: 0.1
 * </pre>
 */
@Data
public class ResolverProperties {

    /**
     * Minimum similarity (0.0-1.0) for a candidate to survive.
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double similarityThreshold = 0.8;

    private boolean enableFuzzyMatching = true;

    private boolean enableContextDisambiguation = true;

    /**
     * Score added per meeting of the context grouping the candidate took part in.
     */
    private double affinityIncrement = 0.1;

    /**
     * Decorative patterns removed from names, applied in order, case-insensitive.
     */
    @NotNull
    private List<String> patternRules = new ArrayList<>(List.of(
        "\\s*\\[[^\\]]*\\]",
        "\\s*\\([^)]*\\)",
        "\\s+-\\s+\\S.*$",
        "\\s*\\|\\s*\\S.*$"
    ));
}
