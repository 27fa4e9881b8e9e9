package uk.gegc.qaloader.features.ingestion.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.List;

@Component
@Data
@Validated
@ConfigurationProperties(prefix = "qaloader.ingestion")
public class IngestionProperties {

    @NotNull(message = "Property qaloader.ingestion.max-file-size-bytes must be configured")
    @Min(value = 1, message = "qaloader.ingestion.max-file-size-bytes must be at least 1")
    private Long maxFileSizeBytes = 10L * 1024 * 1024;

    @NotEmpty(message = "Property qaloader.ingestion.allowed-extensions must list at least one extension")
    private List<String> allowedExtensions = List.of(".md", ".txt");

    @NotNull(message = "Property qaloader.ingestion.question-warning-length must be configured")
    @Min(value = 1, message = "qaloader.ingestion.question-warning-length must be at least 1")
    private Integer questionWarningLength = 500;

    @NotNull(message = "Property qaloader.ingestion.answer-warning-length must be configured")
    @Min(value = 1, message = "qaloader.ingestion.answer-warning-length must be at least 1")
    private Integer answerWarningLength = 1000;

    @NotNull(message = "Property qaloader.ingestion.question-max-length must be configured")
    @Min(value = 1, message = "qaloader.ingestion.question-max-length must be at least 1")
    private Integer questionMaxLength = 5000;

    @NotNull(message = "Property qaloader.ingestion.answer-max-length must be configured")
    @Min(value = 1, message = "qaloader.ingestion.answer-max-length must be at least 1")
    private Integer answerMaxLength = 10000;

    @NotNull(message = "Property qaloader.ingestion.header-max-length must be configured")
    @Min(value = 1, message = "qaloader.ingestion.header-max-length must be at least 1")
    private Integer headerMaxLength = 100;

    @NotNull(message = "Property qaloader.ingestion.duplicate-threshold must be configured")
    @DecimalMin(value = "0.1", message = "qaloader.ingestion.duplicate-threshold must be at least 0.1")
    @DecimalMax(value = "1.0", message = "qaloader.ingestion.duplicate-threshold must be at most 1.0")
    private Double duplicateThreshold = 0.85;

    @NotNull(message = "Property qaloader.ingestion.id-max-attempts must be configured")
    @Min(value = 1, message = "qaloader.ingestion.id-max-attempts must be at least 1")
    private Integer idMaxAttempts = 10;

    @NotNull(message = "Property qaloader.ingestion.insert-max-attempts must be configured")
    @Min(value = 1, message = "qaloader.ingestion.insert-max-attempts must be at least 1")
    private Integer insertMaxAttempts = 3;

    @NotBlank(message = "Property qaloader.ingestion.upload-time-zone must be configured")
    private String uploadTimeZone = "America/New_York";
}
