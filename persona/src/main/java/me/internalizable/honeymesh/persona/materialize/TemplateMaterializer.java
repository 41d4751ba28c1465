package me.internalizable.honeymesh.persona.materialize;

import me.internalizable.honeymesh.persona.template.CustomCommand;
import me.internalizable.honeymesh.persona.template.DirNode;
import me.internalizable.honeymesh.persona.template.TemplateDefinition;
import me.internalizable.honeymesh.persona.template.UserAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Projects a {@link TemplateDefinition} onto a real directory tree.
 *
 * <p>Every declared path is rooted and joined onto the destination through
 * {@link PathGuard}; a path that would land outside the destination fails
 * with {@link PathViolationException} before anything of its step is written.
 * Directory creation is idempotent and file writes overwrite.</p>
 *
 * <h2>Result Layout</h2>
 * <pre>
 * root/
 * ├── proc/ sys/ dev/ run/ tmp/ ...   # standard directories
 * ├── &lt;template filesystem&gt;          # declared directories
 * ├── etc/passwd                      # generated from users
 * ├── home/&lt;user&gt;/.ssh/               # one per user
 * └── &lt;template files&gt;               # declared contents
 * </pre>
 */
public class TemplateMaterializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateMaterializer.class);

    /**
     * Directories every persona has, relative to the root.
     */
    public static final List<String> STANDARD_DIRECTORIES = List.of(
            "proc", "sys", "dev", "run", "tmp",
            "usr/bin", "usr/sbin", "usr/local/bin",
            "sbin", "lib", "bin", "etc", "var/log",
            "opt", "home", "root"
    );

    static final String PASSWD_PATH = "/etc/passwd";
    private static final String SSH_DIR = ".ssh";
    private static final Set<PosixFilePermission> EXECUTABLE = PosixFilePermissions.fromString("rwxr-xr-x");

    /**
     * Validate every declared path, then create directories, files and commands.
     *
     * @param template template to materialize
     * @param root destination for directories and files
     * @param commandsRoot destination for custom command scripts
     * @throws PathViolationException if any declared path escapes its root; nothing is written
     * @throws IOException if a write fails
     */
    public void materialize(@Nonnull TemplateDefinition template, @Nonnull Path root, @Nonnull Path commandsRoot)
            throws IOException {
        Objects.requireNonNull(template, "template");
        validate(template, root, commandsRoot);

        LOGGER.debug("Materializing template '{}' into {}", template.getId(), root);
        materializeDirectories(template, root);
        materializeFiles(template, root);
        materializeCommands(template, commandsRoot);
        LOGGER.info("Materialized template '{}' into {}", template.getId(), root);
    }

    /**
     * Check the containment of every path the template declares without writing anything.
     *
     * @param template template to check
     * @param root destination for directories and files
     * @param commandsRoot destination for custom command scripts
     * @throws PathViolationException on the first path that escapes its root
     */
    public void validate(@Nonnull TemplateDefinition template, @Nonnull Path root, @Nonnull Path commandsRoot)
            throws PathViolationException {
        PathGuard guard = new PathGuard(root);
        directoryTargets(template, guard);
        fileTargets(template, guard);
        commandTargets(template, new PathGuard(commandsRoot));
    }

    /**
     * Create the standard directories, the template's directory tree and a
     * home directory with {@code .ssh} for every user.
     *
     * @param template template to materialize
     * @param root destination root, created if missing
     * @throws PathViolationException if a declared directory or home escapes the root
     * @throws IOException if a directory cannot be created
     */
    public void materializeDirectories(@Nonnull TemplateDefinition template, @Nonnull Path root)
            throws IOException {
        PathGuard guard = new PathGuard(root);
        List<Target> targets = directoryTargets(template, guard);

        Files.createDirectories(guard.root());
        for (Target target : targets) {
            guard.checkOnDisk(target.declared(), target.path());
            Files.createDirectories(target.path());
        }
        LOGGER.debug("Created {} directories for template '{}'", targets.size(), template.getId());
    }

    /**
     * Write {@code /etc/passwd} generated from the users, then every declared
     * file. Later writes replace earlier ones, so a declared {@code /etc/passwd}
     * wins over the generated one.
     *
     * @param template template to materialize
     * @param root destination root, created if missing
     * @throws PathViolationException if a declared file escapes the root
     * @throws IOException if a file cannot be written
     */
    public void materializeFiles(@Nonnull TemplateDefinition template, @Nonnull Path root) throws IOException {
        PathGuard guard = new PathGuard(root);
        Map<Target, String> targets = fileTargets(template, guard);

        Files.createDirectories(guard.root());
        for (Map.Entry<Target, String> entry : targets.entrySet()) {
            writeFile(guard, entry.getKey(), entry.getValue());
        }
        LOGGER.debug("Wrote {} files for template '{}'", targets.size(), template.getId());
    }

    /**
     * Write every custom command script to its install path and mark it executable.
     *
     * @param template template to materialize
     * @param root destination root for scripts, created if missing
     * @throws PathViolationException if a command path escapes the root
     * @throws IOException if a script cannot be written
     */
    public void materializeCommands(@Nonnull TemplateDefinition template, @Nonnull Path root) throws IOException {
        PathGuard guard = new PathGuard(root);
        Map<Target, String> targets = commandTargets(template, guard);
        if (targets.isEmpty()) {
            return;
        }

        Files.createDirectories(guard.root());
        for (Map.Entry<Target, String> entry : targets.entrySet()) {
            Path script = writeFile(guard, entry.getKey(), entry.getValue());
            makeExecutable(script);
        }
        LOGGER.debug("Installed {} custom commands for template '{}'", targets.size(), template.getId());
    }

    /**
     * Write the honeypot credential database for the template's users.
     *
     * @param template source template
     * @param userdb target file
     * @throws IOException if the file cannot be written
     */
    public void writeCredentialDatabase(@Nonnull TemplateDefinition template, @Nonnull Path userdb)
            throws IOException {
        Objects.requireNonNull(userdb, "userdb");
        Path parent = userdb.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(userdb, CredentialFiles.userdb(template), StandardCharsets.UTF_8);
    }

    private List<Target> directoryTargets(TemplateDefinition template, PathGuard guard)
            throws PathViolationException {
        List<Target> targets = new ArrayList<>();
        for (String directory : STANDARD_DIRECTORIES) {
            targets.add(new Target(directory, guard.resolve(directory)));
        }
        collectTree(template.getDirectoryTree(), "", guard, targets);
        for (UserAccount user : template.getUsers().values()) {
            String ssh = user.home() + "/" + SSH_DIR;
            targets.add(new Target(ssh, guard.resolve(ssh)));
        }
        return targets;
    }

    private void collectTree(List<DirNode> nodes, String parent, PathGuard guard, List<Target> targets)
            throws PathViolationException {
        for (DirNode node : nodes) {
            String declared = parent + "/" + node.name();
            targets.add(new Target(declared, guard.resolve(declared)));
            collectTree(node.children(), declared, guard, targets);
        }
    }

    private Map<Target, String> fileTargets(TemplateDefinition template, PathGuard guard)
            throws PathViolationException {
        Map<Target, String> targets = new LinkedHashMap<>();
        targets.put(new Target(PASSWD_PATH, guard.resolve(PASSWD_PATH)), CredentialFiles.passwd(template));
        for (Map.Entry<String, String> file : template.getFileContents().entrySet()) {
            targets.put(new Target(file.getKey(), guard.resolve(file.getKey())), file.getValue());
        }
        return targets;
    }

    private Map<Target, String> commandTargets(TemplateDefinition template, PathGuard guard)
            throws PathViolationException {
        Map<Target, String> targets = new LinkedHashMap<>();
        for (CustomCommand command : template.getCustomCommands().values()) {
            targets.put(new Target(command.path(), guard.resolve(command.path())), command.content());
        }
        return targets;
    }

    private Path writeFile(PathGuard guard, Target target, String content) throws IOException {
        guard.checkOnDisk(target.declared(), target.path());
        Files.createDirectories(target.path().getParent());
        Files.writeString(target.path(), content, StandardCharsets.UTF_8);
        return target.path();
    }

    private void makeExecutable(Path script) throws IOException {
        if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            Files.setPosixFilePermissions(script, EXECUTABLE);
        } else if (!script.toFile().setExecutable(true, false)) {
            throw new IOException("Could not make command executable: " + script);
        }
    }

    private record Target(String declared, Path path) {
    }
}
