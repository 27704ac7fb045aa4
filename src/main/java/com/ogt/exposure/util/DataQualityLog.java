package com.ogt.exposure.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data-quality issues collected while an exposure model is built: unmatched object types, assets
 * beyond the join distance, unresolved elevation pixels, duplicate ids...
 * <p>
 * Every issue is also written to the log at WARN with its count and the first sample ids.
 */
@Data
@Slf4j
public class DataQualityLog {

    public static final int SAMPLE_SIZE = 5;

    private List<Issue> issues = new ArrayList<>();
    private Map<String, Integer> issueCounts = new LinkedHashMap<>();

    @Data
    public static class Issue {
        private String step;
        private String issueType;
        private String message;
        private int count;
        private List<Object> sampleIds;

        public Issue(String step, String issueType, String message, int count, List<Object> sampleIds) {
            this.step = step;
            this.issueType = issueType;
            this.message = message;
            this.count = count;
            this.sampleIds = sampleIds;
        }
    }

    /**
     * Records an issue affecting {@code ids}. Nothing is recorded for an empty collection.
     */
    public void warn(String step, String issueType, Collection<?> ids, String message) {
        if (ids == null || ids.isEmpty()) {
            return;
        }
        List<Object> sample = ids.stream().limit(SAMPLE_SIZE).map(o -> (Object) o).toList();
        issues.add(new Issue(step, issueType, message, ids.size(), sample));
        issueCounts.merge(issueType, ids.size(), Integer::sum);
        log.warn("⚠️ [{}] {}: {} (count={}, sample={})", step, issueType, message, ids.size(), sample);
    }

    public int getIssueCount() {
        return issues.size();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }

    /** Total number of affected rows recorded for one issue type, 0 when never recorded. */
    public int countOf(String issueType) {
        return issueCounts.getOrDefault(issueType, 0);
    }

    public String getSummary() {
        if (issues.isEmpty()) {
            return "No data quality issues";
        }

        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Total issues: %d\n", issues.size()));

        issueCounts.forEach((type, count) ->
                sb.append(String.format("- %s: %d rows\n", type, count))
        );

        sb.append("\nFirst issues:\n");
        issues.stream()
                .limit(5)
                .forEach(i -> sb.append(String.format("[%s] %s (%d) %s\n", i.step, i.message, i.count, i.sampleIds)));

        if (issues.size() > 5) {
            sb.append(String.format("... and %d more\n", issues.size() - 5));
        }

        return sb.toString();
    }

    public String toJson() {
        try {
            return new ObjectMapper()
                    .writeValueAsString(Map.of(
                            "issueCount", getIssueCount(),
                            "issueTypes", issueCounts,
                            "issues", issues.stream().limit(10).toList()
                    ));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Error converting DataQualityLog to JSON", e);
        }
    }
}
