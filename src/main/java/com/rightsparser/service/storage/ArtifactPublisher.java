package com.rightsparser.service.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.ContentStoreException;
import com.rightsparser.model.PublishedArtifact;
import com.rightsparser.util.PayloadEncryptor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.security.GeneralSecurityException;

/**
 * Encrypts an extracted payload and publishes it to content-addressed storage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArtifactPublisher {

    private final ContentStore contentStore;
    private final ObjectMapper objectMapper;
    private final RightsParserProperties properties;

    /**
     * @param payload Validated extraction payload
     * @return Content identifier and the base64 key needed to decrypt it
     */
    public Mono<PublishedArtifact> publish(JsonNode payload) {
        return Mono.fromCallable(() -> encrypt(payload))
                .flatMap(encrypted -> contentStore.put(encrypted.getData())
                        .timeout(properties.getStorage().getPublishTimeout())
                        .map(cid -> PublishedArtifact.builder()
                                .contentId(cid)
                                .encryptionKey(encrypted.getKey())
                                .build()))
                .onErrorMap(error -> !(error instanceof ContentStoreException),
                        error -> new ContentStoreException("Publishing failed: " + error.getMessage(), error));
    }

    private PayloadEncryptor.Encrypted encrypt(JsonNode payload) {
        try {
            String json = objectMapper.writeValueAsString(payload);
            PayloadEncryptor.Encrypted encrypted = PayloadEncryptor.encrypt(json);
            log.debug("Encrypted {} payload characters into {} bytes", json.length(), encrypted.getData().length);
            return encrypted;
        } catch (JsonProcessingException e) {
            throw new ContentStoreException("Payload could not be serialized", e);
        } catch (GeneralSecurityException e) {
            throw new ContentStoreException("Payload could not be encrypted", e);
        }
    }
}
