package com.soundforge.prometheus.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request/error counters of one AI provider since the last reset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ProviderQuota {

    private String provider;
    private long requests;
    private long errors;
    private Instant lastReset;

    public static ProviderQuota fresh(String provider, Instant now) {
        return ProviderQuota.builder()
                .provider(provider)
                .requests(0)
                .errors(0)
                .lastReset(now)
                .build();
    }
}
