package uk.gegc.qaloader.features.ingestion.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "TopicReplaceResult", description = "Outcome of replacing every stored question of one topic")
public record TopicReplaceResult(
        String topic,
        @Schema(description = "Stored questions deleted before the upload")
        int removedCount,
        BatchUploadResult upload
) {
}
