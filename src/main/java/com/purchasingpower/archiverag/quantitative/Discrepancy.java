package com.purchasingpower.archiverag.quantitative;

import lombok.Value;

/**
 * Difference between the entity store and an external meeting source.
 */
@Value
public class Discrepancy {
    int entityStoreCount;
    int sourceCount;
    int sourceUniqueCount;
    int difference;
    String explanation;

    public static Discrepancy between(int entityStoreCount, SourceCount source) {
        int difference = source.getTotal() - entityStoreCount;
        String explanation = difference != 0
            ? String.format("Entity store has %d meetings, but source has %d total entries (%d unique meetings). "
                    + "%d meeting(s) not yet ingested into the entity store.",
                entityStoreCount, source.getTotal(), source.getUnique(), Math.abs(difference))
            : "Counts match between the entity store and the source.";
        return new Discrepancy(entityStoreCount, source.getTotal(), source.getUnique(), difference, explanation);
    }
}
