package com.rightsparser.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result fields written when a job completes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResult {
    private String contentId;
    private String encryptionKey;
    private String parsedJson;
    private String modelUsed;
}
