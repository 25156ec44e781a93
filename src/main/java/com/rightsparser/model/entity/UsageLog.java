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
 * Append-only audit record, one per API request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("usage_logs")
public class UsageLog {

    @Id
    private Long id;

    @Column("job_id")
    private UUID jobId;

    @Column("api_key_hash")
    private String apiKeyHash;

    @Column("endpoint")
    private String endpoint;

    @Column("method")
    private String method;

    @Column("status_code")
    private Integer statusCode;

    @Column("processing_time_ms")
    private Long processingTimeMs;

    @Column("file_size")
    private Long fileSize;

    @Column("ip_address")
    private String ipAddress;

    @Column("user_agent")
    private String userAgent;

    @Column("created_at")
    private LocalDateTime createdAt;
}
