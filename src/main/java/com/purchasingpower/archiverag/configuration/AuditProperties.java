package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class AuditProperties {

    @NotBlank
    private String directory = "audit_logs";
}
