package com.prism.connection;

import reactor.core.publisher.Mono;

/**
 * Opens a named connection to a foreign dimension database.
 *
 * Initializing a connection that is already open succeeds.
 */
public interface ForeignConnectionInitializer {

    Mono<Void> initialize(String connectionId);
}
