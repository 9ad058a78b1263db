package com.soundforge.prometheus.provider;

import reactor.core.publisher.Mono;

/**
 * Unit of AI work that can run against any provider.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ProviderTask<T> {

    /**
     * @param provider name of the provider to run against
     * @return the result; an error signal makes the registry try the next provider
     */
    Mono<T> execute(String provider);
}
