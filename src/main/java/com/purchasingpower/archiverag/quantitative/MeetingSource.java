package com.purchasingpower.archiverag.quantitative;

/**
 * External bulk meeting source used to cross-check entity store counts.
 */
public interface MeetingSource {

    /**
     * @throws com.purchasingpower.archiverag.exception.CollaboratorUnavailableException
     *         if the source cannot be fetched or parsed
     */
    SourceCount count(String url);
}
