package com.rightsparser.service.storage;

import reactor.core.publisher.Mono;

/**
 * Content-addressed blob storage.
 */
public interface ContentStore {

    /**
     * Store bytes and return their content identifier.
     */
    Mono<String> put(byte[] content);
}
