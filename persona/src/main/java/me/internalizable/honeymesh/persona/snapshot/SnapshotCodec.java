package me.internalizable.honeymesh.persona.snapshot;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import me.internalizable.honeymesh.api.snapshot.SnapshotDocument;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON encoding of snapshot documents.
 *
 * <p>Each entry carries a {@code kind} discriminator ({@code directory},
 * {@code symlink} or {@code leaf}) next to its metadata, so the artifact can
 * be read without knowing the tree shape in advance.</p>
 */
public class SnapshotCodec {

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this(false);
    }

    /**
     * @param pretty indent the output for human inspection
     */
    public SnapshotCodec(boolean pretty) {
        this.mapper = new ObjectMapper()
                .configure(SerializationFeature.INDENT_OUTPUT, pretty)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
    }

    public void encode(@Nonnull SnapshotDocument document, @Nonnull OutputStream out) throws IOException {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(out, "out");
        mapper.writeValue(out, document);
    }

    /**
     * Write a document to a file, replacing any existing content.
     *
     * @param document document to write
     * @param path target file
     * @throws IOException if writing fails
     */
    public void write(@Nonnull SnapshotDocument document, @Nonnull Path path) throws IOException {
        try (OutputStream out = Files.newOutputStream(path)) {
            encode(document, out);
        }
    }

    /**
     * Decode a document.
     *
     * @param in encoded document
     * @return decoded document
     * @throws IOException if the input is malformed or of an unsupported format
     */
    @Nonnull
    public SnapshotDocument decode(@Nonnull InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        SnapshotDocument document;
        try {
            document = mapper.readValue(in, SnapshotDocument.class);
        } catch (IllegalArgumentException e) {
            throw new IOException("Malformed snapshot: " + e.getMessage(), e);
        }
        if (document == null) {
            throw new IOException("Snapshot is empty");
        }
        if (!SnapshotDocument.FORMAT.equals(document.format())) {
            throw new IOException("Unsupported snapshot format: " + document.format());
        }
        if (document.version() > SnapshotDocument.CURRENT_VERSION) {
            throw new IOException("Unsupported snapshot version: " + document.version());
        }
        return document;
    }

    @Nonnull
    public SnapshotDocument read(@Nonnull Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return decode(in);
        }
    }
}
