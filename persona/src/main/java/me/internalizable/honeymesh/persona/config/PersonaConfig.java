package me.internalizable.honeymesh.persona.config;

import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.nodes.Tag;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for persona deployment.
 *
 * <p>Loaded from {@code honeymesh/config.yml} and defines where templates
 * and deployments live, the defaults substituted into templates, and the
 * snapshot settings.</p>
 */
public class PersonaConfig {

    private String templatesDirectory = "templates";
    private String deploymentsDirectory = "deployments";
    private TemplateDefaults templateDefaults = new TemplateDefaults();
    private SnapshotConfig snapshot = new SnapshotConfig();

    /**
     * Load configuration from file, creating default if not exists.
     *
     * @param path path to config file
     * @return loaded configuration
     * @throws IOException if loading fails
     */
    @Nonnull
    public static PersonaConfig load(@Nonnull Path path) throws IOException {
        if (!Files.exists(path)) {
            PersonaConfig config = new PersonaConfig();
            config.save(path);
            return config;
        }

        LoaderOptions options = new LoaderOptions();
        Yaml yaml = new Yaml(new Constructor(PersonaConfig.class, options));
        try (InputStream is = Files.newInputStream(path)) {
            PersonaConfig config = yaml.load(is);
            return config != null ? config : new PersonaConfig();
        }
    }

    /**
     * Save configuration to file.
     *
     * @param path path to save to
     * @throws IOException if saving fails
     */
    public void save(@Nonnull Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        // Plain map tag, the loader refuses global class tags
        String text = new Yaml(options).dumpAs(this, Tag.MAP, DumperOptions.FlowStyle.BLOCK);
        Files.writeString(path, text);
    }

    // Getters and Setters

    public String getTemplatesDirectory() {
        return templatesDirectory;
    }

    public void setTemplatesDirectory(String templatesDirectory) {
        this.templatesDirectory = templatesDirectory;
    }

    public String getDeploymentsDirectory() {
        return deploymentsDirectory;
    }

    public void setDeploymentsDirectory(String deploymentsDirectory) {
        this.deploymentsDirectory = deploymentsDirectory;
    }

    public TemplateDefaults getTemplateDefaults() {
        return templateDefaults;
    }

    public void setTemplateDefaults(TemplateDefaults templateDefaults) {
        this.templateDefaults = templateDefaults;
    }

    public SnapshotConfig getSnapshot() {
        return snapshot;
    }

    public void setSnapshot(SnapshotConfig snapshot) {
        this.snapshot = snapshot;
    }

    /**
     * Values substituted when a template leaves a field out.
     */
    public static class TemplateDefaults {
        private String hostname = "honeypot.local";
        private String sshBanner = "SSH-2.0-OpenSSH_8.4p1";
        private String timezone = "US/Eastern";
        private String category = "general";
        private String version = "1.0";
        private String password = "password123";
        private String shell = "/bin/bash";
        private int firstUid = 1000;

        public String getHostname() {
            return hostname;
        }

        public void setHostname(String hostname) {
            this.hostname = hostname;
        }

        public String getSshBanner() {
            return sshBanner;
        }

        public void setSshBanner(String sshBanner) {
            this.sshBanner = sshBanner;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public String getCategory() {
            return category;
        }

        public void setCategory(String category) {
            this.category = category;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getShell() {
            return shell;
        }

        public void setShell(String shell) {
            this.shell = shell;
        }

        public int getFirstUid() {
            return firstUid;
        }

        public void setFirstUid(int firstUid) {
            this.firstUid = firstUid;
        }
    }

    /**
     * Settings for filesystem snapshots.
     */
    public static class SnapshotConfig {
        private int maxDepth = 15;
        private String artifactName = "fs.json";
        private List<String> exclusionPatterns = new ArrayList<>(List.of(
                "/root/fs.pickle",
                "/root/createfs",
                "*.pickle",
                "*cowrie*",
                "*kippo*"
        ));

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public String getArtifactName() {
            return artifactName;
        }

        public void setArtifactName(String artifactName) {
            this.artifactName = artifactName;
        }

        public List<String> getExclusionPatterns() {
            return exclusionPatterns;
        }

        public void setExclusionPatterns(List<String> exclusionPatterns) {
            this.exclusionPatterns = exclusionPatterns != null ? exclusionPatterns : new ArrayList<>();
        }
    }
}
