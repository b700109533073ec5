package com.purchasingpower.archiverag.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionItem {

    private String decision;
    private String rationale;

    /**
     * Scope of the decision as recorded (e.g. "affectsOnlyThisWorkgroup").
     */
    private String effect;
}
