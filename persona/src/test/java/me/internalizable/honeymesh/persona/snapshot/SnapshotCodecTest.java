package me.internalizable.honeymesh.persona.snapshot;

import me.internalizable.honeymesh.api.snapshot.DirectoryEntry;
import me.internalizable.honeymesh.api.snapshot.EntryMetadata;
import me.internalizable.honeymesh.api.snapshot.EntryType;
import me.internalizable.honeymesh.api.snapshot.LeafEntry;
import me.internalizable.honeymesh.api.snapshot.SnapshotDocument;
import me.internalizable.honeymesh.api.snapshot.SymlinkEntry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotCodecTest {

    private final SnapshotCodec codec = new SnapshotCodec();

    private static SnapshotDocument sample() {
        EntryMetadata bin = new EntryMetadata("bin", EntryType.DIRECTORY, 0, 0, 4096, 040755, 1_700_000_000L, null);
        EntryMetadata bash = new EntryMetadata("bash", EntryType.REGULAR_FILE, 0, 0, 1234, 0100755, 1_700_000_001L, null);
        EntryMetadata sh = new EntryMetadata("sh", EntryType.SYMLINK, 0, 0, 4, 0120777, 1_700_000_002L, null);
        EntryMetadata null0 = new EntryMetadata("null", EntryType.CHAR_DEVICE, 0, 0, 0, 020666, 1_700_000_003L, null);
        return SnapshotDocument.of(new DirectoryEntry(EntryMetadata.root(), List.of(
                new DirectoryEntry(bin, List.of(new LeafEntry(bash), new SymlinkEntry(sh, "/bin/bash"))),
                new LeafEntry(null0)
        )));
    }

    private String encode(SnapshotDocument document) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        codec.encode(document, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private SnapshotDocument decode(String json) throws IOException {
        return codec.decode(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void tagsEachEntryWithItsKind() throws IOException {
        String json = encode(sample());

        assertThat(json).contains("\"format\":\"honeymesh-fs\"")
                .contains("\"kind\":\"directory\"")
                .contains("\"kind\":\"symlink\"")
                .contains("\"kind\":\"leaf\"")
                .contains("\"linkTarget\":\"/bin/bash\"");
    }

    @Test
    void decodesEncodedDocument() throws IOException {
        SnapshotDocument document = sample();

        SnapshotDocument decoded = decode(encode(document));

        assertThat(decoded).isEqualTo(document);
        assertThat(decoded.root().lookup("/dev")).isNull();
        assertThat(decoded.root().lookup("/null").type()).isEqualTo(EntryType.CHAR_DEVICE);
    }

    @Test
    void prettyOutputDecodesToo() throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new SnapshotCodec(true).encode(sample(), out);

        assertThat(out.toString(StandardCharsets.UTF_8)).contains("\n");
        assertThat(decode(out.toString(StandardCharsets.UTF_8))).isEqualTo(sample());
    }

    @Test
    void rejectsForeignFormat() throws IOException {
        String json = encode(sample()).replace("\"honeymesh-fs\"", "\"other-fs\"");

        assertThatThrownBy(() -> decode(json))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Unsupported snapshot format");
    }

    @Test
    void rejectsNewerVersion() throws IOException {
        String json = encode(sample()).replace("\"version\":1", "\"version\":99");

        assertThatThrownBy(() -> decode(json))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("version");
    }

    @Test
    void rejectsMalformedInput() throws IOException {
        assertThatThrownBy(() -> decode("not json")).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> decode("null")).isInstanceOf(IOException.class).hasMessageContaining("empty");

        String badName = encode(sample()).replace("\"name\":\"bash\"", "\"name\":\"usr/bash\"");
        assertThatThrownBy(() -> decode(badName)).isInstanceOf(IOException.class);
    }
}
