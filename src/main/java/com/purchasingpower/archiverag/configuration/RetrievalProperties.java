package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class RetrievalProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8090";

    @NotBlank
    private String searchPath = "/api/search";

    private int timeoutSeconds = 10;
}
