package io.supercast.client;

import io.supercast.core.SupercastResponse;

/**
 * Value returned by a block run through {@link SupercastClient#request}, together with the
 * last response the client recorded while the block ran.
 *
 * @param value what the block returned
 * @param response the last response, or {@code null} if the block made no call
 */
public record ScopedResult<T>(T value, SupercastResponse response) {
}
