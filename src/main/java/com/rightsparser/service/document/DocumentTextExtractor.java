package com.rightsparser.service.document;

import reactor.core.publisher.Mono;

import java.nio.file.Path;

/**
 * Converts an uploaded agreement into plain text.
 */
public interface DocumentTextExtractor {

    /**
     * @param file Stored upload
     * @return Non-blank text, or a {@link com.rightsparser.exception.DocumentConversionException}
     */
    Mono<String> extractText(Path file);
}
