package com.rightsparser.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Principal of an admitted request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthenticatedKey {
    private UUID apiKeyId;
    private String keyHash;
    private String keyPrefix;
    private String userId;
}
