package com.rightsparser.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the rights parser.
 */
@Configuration
@ConfigurationProperties(prefix = "rights-parser")
@Validated
@Data
public class RightsParserProperties {

    @Valid
    private WorkerConfig worker = new WorkerConfig();

    @Valid
    private ExtractionConfig extraction = new ExtractionConfig();

    @Valid
    private StorageConfig storage = new StorageConfig();

    @Valid
    private WebhookConfig webhook = new WebhookConfig();

    @Valid
    private AuthConfig auth = new AuthConfig();

    @Valid
    private ApiConfig api = new ApiConfig();

    /**
     * Longest time one claimed job can take when every stage runs into its timeout.
     */
    public Duration maxJobDuration() {
        return extraction.getAttemptTimeout().multipliedBy(extraction.getMaxAttempts())
                .plus(storage.getConversionTimeout())
                .plus(storage.getPublishTimeout());
    }

    @AssertTrue(message = "worker.max-processing-duration must exceed conversion, extraction and publish timeouts combined")
    public boolean isClaimWindowSufficient() {
        return worker.getMaxProcessingDuration().compareTo(maxJobDuration()) > 0;
    }

    @Data
    public static class WorkerConfig {
        /**
         * Start the polling workers when the application is ready.
         */
        private boolean enabled = true;

        /**
         * Number of independent worker loops.
         */
        @Min(1)
        private int concurrency = 4;

        /**
         * Idle wait after a poll that found no pending job.
         */
        private Duration pollInterval = Duration.ofSeconds(5);

        /**
         * Job-level retry budget. A job never records more retries than this.
         */
        @Min(0)
        private int maxRetries = 3;

        /**
         * How long a job may stay claimed before it becomes eligible for reclaim.
         * Must exceed {@link RightsParserProperties#maxJobDuration()}.
         */
        private Duration maxProcessingDuration = Duration.ofMinutes(30);

        private Duration staleCheckInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class ExtractionConfig {
        @NotBlank
        private String baseUrl = "http://localhost:11434";

        /**
         * Pinned model identifier, recorded on every job.
         */
        @NotBlank
        private String model = "llama3.3:70b-instruct-q4_K_M";

        /**
         * Engine calls per extraction, the first call included.
         */
        @Min(1)
        private int maxAttempts = 3;

        private Duration attemptTimeout = Duration.ofMinutes(5);

        /**
         * Agreement text beyond this many characters is not sent to the engine.
         */
        @Min(1)
        private int maxInputChars = 10_000;

        private double temperature = 0.05;

        private int numPredict = 4096;
    }

    @Data
    public static class StorageConfig {
        @NotBlank
        private String uploadDir = "./uploads";

        private DataSize maxFileSize = DataSize.ofMegabytes(50);

        private String pdfToTextCommand = "pdftotext";

        private Duration conversionTimeout = Duration.ofMinutes(2);

        /**
         * Timeout of one content store upload.
         */
        private Duration publishTimeout = Duration.ofMinutes(2);

        private String ipfsUrl = "http://localhost:5001";

        private String pinataUrl = "https://api.pinata.cloud";

        /**
         * When set, artifacts are pinned through Pinata instead of the local node.
         */
        private String pinataJwt;
    }

    @Data
    public static class WebhookConfig {
        @Min(0)
        @Max(10)
        private int maxRetries = 3;

        private Duration initialBackoff = Duration.ofSeconds(1);

        private Duration maxBackoff = Duration.ofSeconds(30);

        /**
         * Timeout of a single delivery attempt.
         */
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class AuthConfig {
        /**
         * Raw API key registered on startup when no key with the same hash exists.
         */
        private String bootstrapKey;

        @Min(1)
        private int bootstrapRateLimit = 100;

        /**
         * Compare-and-set attempts before an admission gives up under contention.
         */
        @Min(1)
        private int maxAdmissionAttempts = 5;
    }

    @Data
    public static class ApiConfig {
        private Duration syncTimeout = Duration.ofMinutes(5);

        private Duration syncPollInterval = Duration.ofSeconds(2);

        @Min(1)
        @Max(100)
        private int recentJobsLimit = 20;
    }
}
