package me.internalizable.honeymesh.persona.template;

import me.internalizable.honeymesh.persona.TemplateFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TemplateLibraryTest {

    @TempDir
    Path dir;

    private Path templates;
    private TemplateLibrary library;

    @BeforeEach
    void setUp() {
        templates = dir.resolve("templates");
        library = new TemplateLibrary(templates, new TemplateParser());
    }

    @Test
    void initializeCreatesMissingDirectory() throws IOException {
        library.initialize();

        assertThat(templates).isDirectory();
        assertThat(library.getAllTemplates()).isEmpty();
    }

    @Test
    void discoversDefinitionsAndSkipsBrokenOnes() throws IOException {
        TemplateFixtures.copyInto(templates, TemplateFixtures.CORPORATE);
        Files.writeString(templates.resolve("broken.yml"), "metadata: [\n");
        Files.writeString(templates.resolve("notes.txt"), "not a template");

        library.initialize();

        assertThat(library.getTemplateIds()).containsExactly("corporate_fileserver");
        assertThat(library.hasTemplate("broken")).isFalse();
    }

    @Test
    void lookupIgnoresDefaultLocale() throws IOException {
        TemplateFixtures.copyInto(templates, TemplateFixtures.CORPORATE);
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            library.initialize();

            assertThat(library.hasTemplate("CORPORATE_FILESERVER")).isTrue();
            assertThat(library.getTemplate("Corporate_FileServer")).isNotNull();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void looksUpCaseInsensitively() throws IOException {
        TemplateFixtures.copyInto(templates, TemplateFixtures.CORPORATE);
        library.initialize();

        TemplateDefinition template = library.getTemplate("CORPORATE_FileServer");
        assertThat(template).isNotNull();
        assertThat(template.getId()).isEqualTo("corporate_fileserver");
        assertThat(library.getTemplate("missing")).isNull();
    }

    @Test
    void summarizesByCategory() throws IOException {
        TemplateFixtures.copyInto(templates, TemplateFixtures.CORPORATE);
        Files.writeString(templates.resolve("lab.yaml"), "metadata:\n  name: Lab box\n  category: research\n");
        library.initialize();

        assertThat(library.listTemplates()).extracting(TemplateLibrary.TemplateSummary::id)
                .containsExactly("corporate_fileserver", "lab");
        assertThat(library.getTemplatesByCategory("Corporate"))
                .containsExactly(new TemplateLibrary.TemplateSummary("corporate_fileserver",
                        "Corporate File Server",
                        "Windows-domain joined Samba file server for a mid-size company",
                        "corporate", "2.1"));
    }

    @Test
    void savesNewDefinitionAndRefusesDuplicates() throws IOException {
        TemplateFixtures.copyInto(templates, TemplateFixtures.CORPORATE);
        library.initialize();

        TemplateDefinition lab = new TemplateParser().parse("lab", "users:\n  root: toor\nfilesystem:\n  opt:\n");
        Path saved = library.saveTemplate(lab);

        assertThat(saved).isEqualTo(templates.resolve("lab.yaml"));
        assertThat(library.getTemplate("lab").getUsers()).isEqualTo(lab.getUsers());

        TemplateDefinition duplicate = library.load(TemplateFixtures.path(TemplateFixtures.CORPORATE));
        assertThatThrownBy(() -> library.saveTemplate(duplicate))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("already exists");
    }

    @Test
    void reloadsSingleTemplate() throws IOException {
        Path file = TemplateFixtures.copyInto(templates, TemplateFixtures.CORPORATE);
        library.initialize();

        Files.writeString(file, "metadata:\n  name: Replaced\n");
        assertThat(library.reloadTemplate("corporate_fileserver")).isTrue();
        assertThat(library.getTemplate("corporate_fileserver").getMetadata().name()).isEqualTo("Replaced");

        Files.delete(file);
        assertThat(library.reloadTemplate("corporate_fileserver")).isFalse();
        assertThat(library.hasTemplate("corporate_fileserver")).isFalse();
    }

    @Test
    void addsTemplateFromOutsideDirectory() throws IOException {
        library.initialize();

        assertThat(library.addTemplateFromFile(TemplateFixtures.path(TemplateFixtures.CORPORATE))).isTrue();
        assertThat(library.hasTemplate("corporate_fileserver")).isTrue();
        assertThat(library.addTemplateFromFile(dir.resolve("nowhere.yaml"))).isFalse();
    }
}
