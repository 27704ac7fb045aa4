package com.ogt.exposure.service;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Values joined onto a primary layer: exactly one entry per primary feature id (null when nothing
 * matched), plus the ids that got no value.
 */
@Value
public class JoinResult {

    Map<Long, Object> values;
    List<Long> unmatched;

    public int size() {
        return values.size();
    }

    public int matchedCount() {
        return values.size() - unmatched.size();
    }
}
