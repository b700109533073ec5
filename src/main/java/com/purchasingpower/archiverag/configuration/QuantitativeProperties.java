package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class QuantitativeProperties {

    /**
     * Default bulk meeting source for cross-checks, empty to disable.
     */
    private String sourceUrl = "";

    @Min(1)
    private int sourceTimeoutSeconds = 10;

    @Min(1)
    private int citationSampleSize = 10;
}
