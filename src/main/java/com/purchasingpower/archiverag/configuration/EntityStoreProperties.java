package com.purchasingpower.archiverag.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Location of the JSON entity store. One sub-directory per entity kind,
 * one {@code <uuid>.json} file per entity.
 */
@Data
public class EntityStoreProperties {

    @NotBlank
    private String baseDirectory = "entities";

    @NotBlank
    private String peopleDirectory = "people";

    @NotBlank
    private String workgroupsDirectory = "workgroups";

    @NotBlank
    private String topicsDirectory = "topics";

    @NotBlank
    private String meetingsDirectory = "meetings";
}
