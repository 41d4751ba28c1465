package me.internalizable.honeymesh.persona.materialize;

import me.internalizable.honeymesh.persona.TemplateFixtures;
import me.internalizable.honeymesh.persona.template.TemplateDefinition;
import me.internalizable.honeymesh.persona.template.TemplateParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateMaterializerTest {

    @TempDir
    Path dir;

    private final TemplateParser parser = new TemplateParser();
    private final TemplateMaterializer materializer = new TemplateMaterializer();

    private Path root;
    private Path commands;
    private TemplateDefinition corporate;

    @BeforeEach
    void setUp() throws IOException {
        root = dir.resolve("honeyfs");
        commands = dir.resolve("txtcmds");
        corporate = parser.load(TemplateFixtures.path(TemplateFixtures.CORPORATE));
    }

    @Test
    void createsStandardDeclaredAndHomeDirectories() throws IOException {
        materializer.materialize(corporate, root, commands);

        for (String standard : TemplateMaterializer.STANDARD_DIRECTORIES) {
            assertThat(root.resolve(standard)).isDirectory();
        }
        assertThat(root.resolve("srv/samba/finance")).isDirectory();
        assertThat(root.resolve("srv/samba/shared")).isDirectory();
        assertThat(root.resolve("var/backups")).isDirectory();
        assertThat(root.resolve("opt/monitoring")).isDirectory();
        assertThat(root.resolve("home/admin/.ssh")).isDirectory();
        assertThat(root.resolve("home/guest/.ssh")).isDirectory();
    }

    @Test
    void directoryCreationIsIdempotent() throws IOException {
        materializer.materializeDirectories(corporate, root);
        Set<Path> first = tree(root);

        materializer.materializeDirectories(corporate, root);

        assertThat(tree(root)).isEqualTo(first);
    }

    @Test
    void writesDeclaredFilesVerbatim() throws IOException {
        materializer.materialize(corporate, root, commands);

        for (var file : corporate.getFileContents().entrySet()) {
            assertThat(root.resolve(file.getKey().substring(1))).hasContent(file.getValue());
        }
        assertThat(Files.readString(root.resolve("etc/hostname"))).isEqualTo("fs01\n");
    }

    @Test
    void generatesPasswdFromUsers() throws IOException {
        materializer.materializeFiles(corporate, root);

        List<String> lines = Files.readAllLines(root.resolve("etc/passwd"));
        assertThat(lines).containsExactly(
                "root:x:0:0:root:/root:/bin/bash",
                "admin:x:1001:1001:Domain Administrator:/home/admin:/bin/bash",
                "backup:x:1002:1002:backup:/home/backup:/bin/sh",
                "guest:x:1003:1003:guest:/home/guest:/bin/bash");
    }

    @Test
    void declaredRootUserReplacesFixedRootLine() throws IOException {
        TemplateDefinition template = parser.parse("rooted",
                "users:\n  root:\n    password: toor\n    uid: 0\n    home: /root\n");

        materializer.materializeFiles(template, root);

        List<String> lines = Files.readAllLines(root.resolve("etc/passwd"));
        assertThat(lines).containsExactly("root:x:0:0:root:/root:/bin/bash");
    }

    @Test
    void declaredPasswdWinsOverGenerated() throws IOException {
        TemplateDefinition template = parser.parse("custom",
                "users:\n  bob: pw\nfiles:\n  /etc/passwd: \"root:x:0:0::/:/bin/false\\n\"\n");

        materializer.materializeFiles(template, root);

        assertThat(root.resolve("etc/passwd")).hasContent("root:x:0:0::/:/bin/false\n");
    }

    @Test
    void installsExecutableCommands() throws IOException {
        materializer.materialize(corporate, root, commands);

        Path smbstatus = commands.resolve("usr/local/bin/smbstatus");
        assertThat(smbstatus).isRegularFile();
        assertThat(Files.isExecutable(smbstatus)).isTrue();
        assertThat(smbstatus).hasContent(corporate.getCustomCommands().get("smbstatus").content());
        assertThat(commands.resolve("usr/local/bin/backup-now")).isRegularFile();
        assertThat(root.resolve("usr/local/bin/smbstatus")).doesNotExist();
    }

    @Test
    void writesCredentialDatabase() throws IOException {
        Path userdb = dir.resolve("config/userdb.txt");

        materializer.writeCredentialDatabase(corporate, userdb);

        assertThat(userdb).hasContent("admin:x:Winter2023!\nbackup:x:backup\nguest:x:guest\n");
    }

    @Test
    void escapingFilePathWritesNothing() throws IOException {
        TemplateDefinition template = parser.parse("escape",
                "filesystem:\n  opt:\nfiles:\n  /etc/issue: hello\n  /../../outside.txt: pwned\n");

        assertThatThrownBy(() -> materializer.materialize(template, root, commands))
                .isInstanceOf(PathViolationException.class)
                .hasMessageContaining("/../../outside.txt");

        assertThat(root).doesNotExist();
        assertThat(commands).doesNotExist();
        assertThat(dir.resolve("outside.txt")).doesNotExist();
        assertThat(dir.getParent().resolve("outside.txt")).doesNotExist();
    }

    @Test
    void escapingDirectoryIsRejected() throws IOException {
        TemplateDefinition template = parser.parse("escape", "filesystem:\n  \"..\":\n    loot:\n");

        assertThatThrownBy(() -> materializer.materializeDirectories(template, root))
                .isInstanceOf(PathViolationException.class);
        assertThat(dir.resolve("loot")).doesNotExist();
    }

    @Test
    void escapingCommandPathIsRejected() throws IOException {
        TemplateDefinition template = parser.parse("escape",
                "custom_commands:\n  evil:\n    path: /../evil\n    content: x\n");

        assertThatThrownBy(() -> materializer.validate(template, root, commands))
                .isInstanceOf(PathViolationException.class);
    }

    @Test
    void refusesToWriteThroughLinkLeavingRoot() throws IOException {
        Path outside = Files.createDirectory(dir.resolve("outside"));
        Files.createDirectories(root);
        Files.createSymbolicLink(root.resolve("etc"), outside);

        assertThatThrownBy(() -> materializer.materializeFiles(corporate, root))
                .isInstanceOf(PathViolationException.class)
                .hasMessageContaining("outside the root");
        try (Stream<Path> leaked = Files.list(outside)) {
            assertThat(leaked).isEmpty();
        }
    }

    private static Set<Path> tree(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.map(root::relativize).collect(Collectors.toSet());
        }
    }
}
