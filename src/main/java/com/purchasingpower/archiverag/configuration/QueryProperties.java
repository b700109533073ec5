package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class QueryProperties {

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(1)
    private int topK = 5;

    private long seed = 42L;

    private boolean requireEntityExtraction = true;

    @Min(1)
    private int minLength = 3;
}
