package uk.gegc.qaloader.features.ingestion.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;
import uk.gegc.qaloader.features.ingestion.config.IngestionProperties;
import uk.gegc.qaloader.features.ingestion.domain.model.MarkdownDocument;
import uk.gegc.qaloader.shared.exception.DocumentRejectedException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Turns an upload into text: extension and size are checked before decoding,
 * and decoding is strict UTF-8 with a leading byte order mark removed.
 */
@Component
@RequiredArgsConstructor
public class MarkdownDocumentReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final IngestionProperties properties;

    public MarkdownDocument read(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new DocumentRejectedException("Uploaded file is empty");
        }
        checkExtension(file.getOriginalFilename());
        checkSize(file.getSize());
        try {
            return read(file.getOriginalFilename(), file.getBytes());
        } catch (IOException e) {
            throw new DocumentRejectedException("Could not read uploaded file", e);
        }
    }

    public MarkdownDocument read(String filename, byte[] content) {
        if (content == null || content.length == 0) {
            throw new DocumentRejectedException("Uploaded file is empty");
        }
        checkExtension(filename);
        checkSize(content.length);

        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(content))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new DocumentRejectedException("File is not valid UTF-8 text", e);
        }

        if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
            text = text.substring(1);
        }
        return new MarkdownDocument(filename, content.length, text);
    }

    private void checkExtension(String filename) {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT);
        boolean allowed = properties.getAllowedExtensions().stream()
                .anyMatch(extension -> lower.endsWith(extension.toLowerCase(Locale.ROOT)));
        if (!allowed) {
            throw new DocumentRejectedException("Invalid file type '" + filename + "'. Allowed extensions: "
                    + String.join(", ", properties.getAllowedExtensions()));
        }
    }

    private void checkSize(long size) {
        if (size > properties.getMaxFileSizeBytes()) {
            throw DocumentRejectedException.tooLarge(size, properties.getMaxFileSizeBytes());
        }
    }
}
