package com.xammer.anomaly.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.costexplorer.model.RootCause;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attaches the same configured labels to every root cause.
 * Replace this bean to wire a real tagging source.
 */
@Component
public class ConfiguredTagProvider implements RootCauseTagProvider {

    private final Map<String, String> tags;

    public ConfiguredTagProvider(@Value("#{${anomaly.report.tags:{:}}}") Map<String, String> tags) {
        this.tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    @Override
    public Map<String, String> tagsFor(RootCause rootCause) {
        return tags;
    }
}
