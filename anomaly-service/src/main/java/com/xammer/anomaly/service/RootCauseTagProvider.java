package com.xammer.anomaly.service;

import software.amazon.awssdk.services.costexplorer.model.RootCause;

import java.util.Map;

/**
 * Supplies the descriptive labels attached to a resolved root cause.
 */
public interface RootCauseTagProvider {

    Map<String, String> tagsFor(RootCause rootCause);
}
