package com.rightsparser.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * API Key entity for tenant authentication.
 * Only the SHA-256 hash of the key is stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("api_keys")
public class ApiKey {

    @Id
    private UUID id;

    @Column("key_hash")
    private String keyHash;

    @Column("key_prefix")
    private String keyPrefix;

    @Column("name")
    private String name;

    @Column("user_id")
    private String userId;

    @Column("organization")
    private String organization;

    @Column("is_active")
    private Boolean active;

    // Requests per rolling hour
    @Column("rate_limit")
    private Integer rateLimit;

    @Column("requests_count")
    private Long requestsCount;

    @Column("last_used_at")
    private LocalDateTime lastUsedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("expires_at")
    private LocalDateTime expiresAt;

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
