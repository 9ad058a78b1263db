package com.soundforge.prometheus.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderStats {

    long requests;
    long errors;

    /** Percentage of requests that did not fail; 100 when idle */
    double successRate;

    public static ProviderStats from(ProviderQuota quota) {
        double successRate = quota.getRequests() > 0
                ? ((double) (quota.getRequests() - quota.getErrors()) / quota.getRequests()) * 100
                : 100.0;
        return ProviderStats.builder()
                .requests(quota.getRequests())
                .errors(quota.getErrors())
                .successRate(successRate)
                .build();
    }
}
