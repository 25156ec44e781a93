package com.rightsparser.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishedArtifact {
    private String contentId;
    private String encryptionKey; // base64 AES-256 key
}
