package uk.gegc.qaloader.features.staging.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.qaloader.features.staging.domain.model.ReviewAction;

import java.util.List;
import java.util.UUID;

@Schema(name = "ReviewRequest", description = "Approve or reject staged questions of one batch")
public record ReviewRequest(
        @NotEmpty(message = "At least one staged question id is required")
        List<@NotNull UUID> stagedQuestionIds,
        @NotNull(message = "Review action is required")
        ReviewAction action,
        @Size(max = 25, message = "reviewedBy must be at most 25 characters")
        @Schema(description = "Reviewer name")
        String reviewedBy,
        @Size(max = 255, message = "reviewNotes must be at most 255 characters")
        String reviewNotes
) {
}
