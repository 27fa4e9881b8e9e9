package uk.gegc.qaloader.features.ingestion.domain.model;

/**
 * Audit fields stamped on every record of one upload. All optional.
 */
public record UploadMetadata(String uploadedBy, String uploadNotes, String uploadedOn) {

    public static UploadMetadata empty() {
        return new UploadMetadata(null, null, null);
    }

    public UploadMetadata withUploadedOn(String value) {
        return new UploadMetadata(uploadedBy, uploadNotes, value);
    }
}
