/**
 * REST surface for archive questions and relationship lookups.
 *
 * @since 1.0.0
 */
package com.purchasingpower.archiverag.api;
