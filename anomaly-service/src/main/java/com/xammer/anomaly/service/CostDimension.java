package com.xammer.anomaly.service;

import software.amazon.awssdk.services.costexplorer.model.Dimension;

/**
 * Dimensions a usage query can be constrained by. Declaration order is the order
 * clauses appear in a combined filter.
 */
public enum CostDimension {
    SERVICE(Dimension.SERVICE),
    REGION(Dimension.REGION),
    USAGE_TYPE(Dimension.USAGE_TYPE),
    LINKED_ACCOUNT(Dimension.LINKED_ACCOUNT);

    private final Dimension sdkDimension;

    CostDimension(Dimension sdkDimension) {
        this.sdkDimension = sdkDimension;
    }

    public Dimension getSdkDimension() {
        return sdkDimension;
    }
}
