package com.rightsparser.service.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.rightsparser.config.RightsParserProperties;
import com.rightsparser.exception.ContentStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * IPFS storage through a local node's HTTP API, or through Pinata when a JWT is configured.
 */
@Slf4j
@Service
public class IpfsContentStore implements ContentStore {

    static final String ARTIFACT_NAME = "rights.json.enc";

    private final WebClient.Builder webClientBuilder;
    private final RightsParserProperties.StorageConfig config;

    public IpfsContentStore(WebClient.Builder webClientBuilder, RightsParserProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.config = properties.getStorage();
    }

    @Override
    public Mono<String> put(byte[] content) {
        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return ARTIFACT_NAME;
            }
        }).contentType(MediaType.APPLICATION_OCTET_STREAM);

        boolean pinata = usePinata();
        String baseUrl = pinata ? config.getPinataUrl() : config.getIpfsUrl();
        String path = pinata ? "/pinning/pinFileToIPFS" : "/api/v0/add";
        String hashField = pinata ? "IpfsHash" : "Hash";

        WebClient.RequestBodySpec request = webClientBuilder.clone()
                .baseUrl(baseUrl)
                .build()
                .post()
                .uri(path)
                .contentType(MediaType.MULTIPART_FORM_DATA);
        if (pinata) {
            request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getPinataJwt());
        }

        return request.body(BodyInserters.fromMultipartData(body.build()))
                .retrieve()
                .bodyToMono(JsonNode.class)
                .map(response -> {
                    JsonNode hash = response.get(hashField);
                    if (hash == null || hash.asText().isBlank()) {
                        throw new ContentStoreException("Storage response has no '" + hashField + "' field");
                    }
                    return hash.asText();
                })
                .doOnSuccess(cid -> log.info("Stored {} bytes at {} as {}", content.length, baseUrl, cid))
                .onErrorMap(error -> !(error instanceof ContentStoreException),
                        error -> new ContentStoreException("Upload to " + baseUrl + " failed: " + error.getMessage(),
                                error));
    }

    private boolean usePinata() {
        return config.getPinataJwt() != null && !config.getPinataJwt().isBlank();
    }
}
