package com.ogt.exposure.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataQualityLogTest {

    @Test
    void countsAddUpPerIssueType() {
        DataQualityLog log = new DataQualityLog();

        log.warn("damage", "UNMATCHED_OBJECT_TYPE", List.of(1L, 2L), "no damage value");
        log.warn("linking", "UNMATCHED_OBJECT_TYPE", List.of(7L), "no curve");
        log.warn("join", "BEYOND_MAX_DISTANCE", List.of(3L), "too far");

        assertEquals(3, log.getIssueCount());
        assertEquals(3, log.countOf("UNMATCHED_OBJECT_TYPE"));
        assertEquals(1, log.countOf("BEYOND_MAX_DISTANCE"));
        assertEquals(0, log.countOf("NODATA"));
    }

    @Test
    void sampleIsCappedButCountIsNot() {
        DataQualityLog log = new DataQualityLog();

        log.warn("elevation", "NODATA", List.of(1, 2, 3, 4, 5, 6, 7), "no pixel");

        DataQualityLog.Issue issue = log.getIssues().get(0);
        assertEquals(7, issue.getCount());
        assertEquals(DataQualityLog.SAMPLE_SIZE, issue.getSampleIds().size());
    }

    @Test
    void emptyIdsRecordNothing() {
        DataQualityLog log = new DataQualityLog();

        log.warn("join", "BEYOND_MAX_DISTANCE", List.of(), "too far");

        assertFalse(log.hasIssues());
        assertEquals("No data quality issues", log.getSummary());
    }

    @Test
    void summaryAndJsonNameTheIssueTypes() {
        DataQualityLog log = new DataQualityLog();
        log.warn("setup", "DUPLICATE_ID", List.of(4L, 4L), "renumbered");

        assertTrue(log.getSummary().contains("- DUPLICATE_ID: 2 rows"));
        assertTrue(log.toJson().contains("\"DUPLICATE_ID\":2"));
    }
}
