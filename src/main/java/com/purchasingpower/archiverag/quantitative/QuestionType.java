package com.purchasingpower.archiverag.quantitative;

/**
 * Quantitative questions the aggregator can answer.
 */
public enum QuestionType {
    MEETINGS_TOTAL("How many meetings are there?"),
    MEETINGS_BY_WORKGROUP("How many meetings did the Archives Workgroup hold?"),
    WORKGROUPS_TOTAL("How many workgroups are there?"),
    PEOPLE_TOTAL("How many people are in the archive?"),
    PEOPLE_BY_WORKGROUP("How many people attended Archives Workgroup meetings?"),
    DECISIONS_TOTAL("How many decisions were made in 2025?"),
    DECISIONS_BY_WORKGROUP("How many decisions did the Archives Workgroup make?"),
    TOPICS_TOTAL("How many topics are there?"),
    TOPICS_BY_WORKGROUP("How many topics did the Archives Workgroup discuss?"),
    AVERAGE_MEETINGS_PER_WORKGROUP("What is the average number of meetings per workgroup?"),
    MEDIAN_MEETINGS_PER_WORKGROUP("What is the median number of meetings per workgroup?"),
    MIN_MEETINGS_PER_WORKGROUP("Which workgroup held the minimum number of meetings?"),
    MAX_MEETINGS_PER_WORKGROUP("Which workgroup held the maximum number of meetings?"),
    MONTHLY_TREND("What is the trend of meetings per month in 2025?"),
    UNSUPPORTED(null);

    private final String example;

    QuestionType(String example) {
        this.example = example;
    }

    public String getExample() {
        return example;
    }
}
