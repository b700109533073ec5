package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GenerationProperties {

    @NotBlank
    private String baseUrl = "http://localhost:11434";

    @NotBlank
    private String model = "qwen2.5-coder:7b";

    private double temperature = 0.0;

    private int timeoutSeconds = 25;
}
