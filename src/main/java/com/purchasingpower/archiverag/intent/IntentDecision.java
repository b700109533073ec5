package com.purchasingpower.archiverag.intent;

import com.purchasingpower.archiverag.core.IntentType;
import lombok.Value;

@Value
public class IntentDecision {
    IntentType intent;
    String ruleName;
    QuerySignals signals;
}
