package com.soundforge.prometheus.api.v1;

import com.soundforge.prometheus.domain.ResourceNotFoundException;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Mono;

/**
 * Wraps a controller body in a 200 response. Unknown resources pass through to
 * {@link ApiExceptionHandler} as 404; any other error becomes a 500 with the given message.
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static <T> Mono<ResponseEntity<T>> ok(Mono<T> body, String failureMessage) {
        return body.map(value -> ResponseEntity.ok(value))
                .onErrorMap(e -> !(e instanceof ResourceNotFoundException || e instanceof ApiException),
                        e -> ApiException.failed(failureMessage, e));
    }
}
