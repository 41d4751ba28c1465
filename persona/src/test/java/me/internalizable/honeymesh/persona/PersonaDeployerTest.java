package me.internalizable.honeymesh.persona;

import me.internalizable.honeymesh.api.snapshot.DirectoryEntry;
import me.internalizable.honeymesh.api.snapshot.SnapshotDocument;
import me.internalizable.honeymesh.persona.materialize.PathViolationException;
import me.internalizable.honeymesh.persona.snapshot.SnapshotCodec;
import me.internalizable.honeymesh.persona.snapshot.SnapshotResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PersonaDeployerTest {

    @TempDir
    Path home;

    private PersonaDeployer deployer;

    @BeforeEach
    void setUp() throws IOException {
        TemplateFixtures.copyInto(home.resolve("templates"), TemplateFixtures.CORPORATE);
        deployer = new PersonaDeployer(home);
        deployer.initialize();
    }

    @Test
    void initializeWritesDefaultConfigAndLoadsTemplates() {
        assertThat(home.resolve("config.yml")).isRegularFile();
        assertThat(home.resolve("deployments")).isDirectory();
        assertThat(deployer.getLibrary().getTemplateIds()).containsExactly("corporate_fileserver");
        assertThatThrownBy(() -> deployer.initialize()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deployBuildsCompleteLayout() throws IOException {
        PersonaDeployer.DeploymentResult result = deployer.deploy("corporate_fileserver", "fs-01");

        Path directory = home.resolve("deployments/fs-01");
        assertThat(result.directory()).isEqualTo(directory);
        assertThat(directory.resolve("honeyfs/etc/passwd")).isRegularFile();
        assertThat(directory.resolve("honeyfs/srv/samba/finance/Q3_budget.csv")).isRegularFile();
        assertThat(directory.resolve("txtcmds/usr/local/bin/smbstatus")).isRegularFile();
        assertThat(directory.resolve("config/userdb.txt")).hasContent("admin:x:Winter2023!\nbackup:x:backup\nguest:x:guest\n");
        assertThat(directory.resolve("share/fs.json")).isRegularFile();
        assertThat(directory.resolve("deployment.yml")).isRegularFile();
        assertThat(result.snapshotPath()).isEqualTo(directory.resolve("share/fs.json"));
    }

    @Test
    void snapshotDescribesMaterializedFilesystem() throws IOException {
        PersonaDeployer.DeploymentResult result = deployer.deploy("corporate_fileserver", "fs-01");

        SnapshotDocument document = new SnapshotCodec().read(result.snapshotPath());

        assertThat(document.root().lookup("/srv/samba/finance")).isInstanceOf(DirectoryEntry.class);
        assertThat(document.root().lookup("/etc/hostname").metadata().size()).isEqualTo(5);
        assertThat(document.root().lookup("/home/admin/.ssh")).isInstanceOf(DirectoryEntry.class);
        assertThat(document.root().lookup("/usr/local/bin/smbstatus")).isNull();
        assertThat(result.snapshot().entryCount()).isGreaterThan(20);
    }

    @Test
    @SuppressWarnings("unchecked")
    void recordsDeployment() throws IOException {
        PersonaDeployer.DeploymentResult result = deployer.deploy("corporate_fileserver", "fs-01");

        Map<String, Object> record;
        try (var reader = Files.newBufferedReader(result.directory().resolve("deployment.yml"))) {
            record = new Yaml(new SafeConstructor(new LoaderOptions())).load(reader);
        }

        assertThat(record).containsEntry("name", "fs-01")
                .containsEntry("template", "corporate_fileserver")
                .containsEntry("hostname", "fs01.corp.local")
                .containsEntry("snapshot", "share/fs.json")
                .containsEntry("entries", result.snapshot().entryCount());
        assertThat((List<String>) record.get("users")).containsExactly("admin", "backup", "guest");
    }

    @Test
    void refusesExistingDeployment() throws IOException {
        deployer.deploy("corporate_fileserver", "fs-01");
        Path artifact = home.resolve("deployments/fs-01/share/fs.json");
        byte[] before = Files.readAllBytes(artifact);

        assertThatThrownBy(() -> deployer.deploy("corporate_fileserver", "fs-01"))
                .isInstanceOf(FileAlreadyExistsException.class);

        assertThat(Files.readAllBytes(artifact)).isEqualTo(before);
    }

    @Test
    void rejectsUnknownTemplateAndBadNames() {
        assertThatThrownBy(() -> deployer.deploy("nonexistent", "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Template not found");
        assertThatThrownBy(() -> deployer.deploy("corporate_fileserver", "../escape"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(home.resolve("deployments/x")).doesNotExist();
        assertThat(home.resolve("escape")).doesNotExist();
    }

    @Test
    void failedMaterializationLeavesNoDeployment() throws IOException {
        Files.writeString(home.resolve("templates/escape.yaml"),
                "files:\n  /etc/motd: hi\n  /../../outside.txt: pwned\n");
        deployer.reload();

        assertThatThrownBy(() -> deployer.deploy("escape", "bad"))
                .isInstanceOf(PathViolationException.class);

        assertThat(home.resolve("deployments/bad")).doesNotExist();
        assertThat(home.resolve("deployments/outside.txt")).doesNotExist();
    }

    @Test
    void snapshotAppliesOverrides() throws IOException {
        Path source = Files.createDirectories(home.resolve("tree/a/b"));
        Files.writeString(home.resolve("tree/a/keep.txt"), "k");
        Files.writeString(home.resolve("tree/a/drop.bak"), "d");
        Files.writeString(home.resolve("tree/a/old.pickle"), "p");

        SnapshotResult result = deployer.snapshot(home.resolve("tree"), home.resolve("tree.json"), 1,
                List.of("*.bak"), false);

        assertThat(source).isDirectory();
        assertThat(result.root().lookup("/a")).isInstanceOf(DirectoryEntry.class);
        assertThat(((DirectoryEntry) result.root().lookup("/a")).children()).isEmpty();
        assertThat(home.resolve("tree.json")).isRegularFile();

        SnapshotResult deeper = deployer.snapshot(home.resolve("tree"), home.resolve("tree2.json"), -1,
                List.of("*.bak"), false);
        assertThat(deeper.root().lookup("/a/keep.txt")).isNotNull();
        assertThat(deeper.root().lookup("/a/drop.bak")).isNull();
        assertThat(deeper.root().lookup("/a/old.pickle")).isNotNull();

        SnapshotResult defaults = deployer.snapshot(home.resolve("tree"), home.resolve("tree3.json"), -1,
                List.of(), true);
        assertThat(defaults.root().lookup("/a/old.pickle")).isNull();
    }

    @Test
    void requiresInitialization() {
        PersonaDeployer fresh = new PersonaDeployer(home.resolve("other"));

        assertThat(fresh.isInitialized()).isFalse();
        assertThatThrownBy(() -> fresh.deploy("corporate_fileserver", "x"))
                .isInstanceOf(IllegalStateException.class);
    }
}
