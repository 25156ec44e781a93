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
 * Processing record of one uploaded agreement.
 * Transitions are applied only through conditional updates in {@code JobStore}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("jobs")
public class Job {

    @Id
    private UUID id;

    @Column("file_name")
    private String fileName;

    @Column("file_path")
    private String filePath;

    @Column("file_size")
    private Long fileSize;

    @Column("api_key_hash")
    private String apiKeyHash;

    @Column("user_id")
    private String userId;

    @Column("status")
    private JobStatus status;

    @Column("worker_id")
    private String workerId;

    // Incremented on every transition, guards each conditional update
    @Column("lock_version")
    private Long lockVersion;

    @Column("ipfs_cid")
    private String ipfsCid;

    @Column("encryption_key")
    private String encryptionKey;

    @Column("parsed_json")
    private String parsedJson; // JSON text

    @Column("error_message")
    private String errorMessage;

    @Column("retry_count")
    private Integer retryCount;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("completed_at")
    private LocalDateTime completedAt;

    @Column("processing_time_ms")
    private Long processingTimeMs;

    @Column("model_used")
    private String modelUsed;

    @Column("webhook_url")
    private String webhookUrl;

    @Column("webhook_sent")
    private Boolean webhookSent;
}
