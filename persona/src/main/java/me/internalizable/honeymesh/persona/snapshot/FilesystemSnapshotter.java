package me.internalizable.honeymesh.persona.snapshot;

import me.internalizable.honeymesh.api.snapshot.DirectoryEntry;
import me.internalizable.honeymesh.api.snapshot.EntryMetadata;
import me.internalizable.honeymesh.api.snapshot.EntryType;
import me.internalizable.honeymesh.api.snapshot.LeafEntry;
import me.internalizable.honeymesh.api.snapshot.SnapshotDocument;
import me.internalizable.honeymesh.api.snapshot.SnapshotEntry;
import me.internalizable.honeymesh.api.snapshot.SymlinkEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Walks a real directory tree into a snapshot and writes it as one artifact.
 *
 * <p>The walk is depth-first and pre-order. Entries are classified from
 * their own attributes, links are never followed, and file contents are
 * never read. Children are sorted by name so that the same tree always
 * produces the same artifact.</p>
 *
 * <p>Only the preconditions are fatal: a source that is not a directory and
 * an output that already exists. Everything that goes wrong below the root
 * is logged, recorded in {@link SnapshotResult#skipped()} and walked
 * around.</p>
 */
public class FilesystemSnapshotter {

    private static final Logger LOGGER = LoggerFactory.getLogger(FilesystemSnapshotter.class);

    public static final int DEFAULT_MAX_DEPTH = 15;

    private static final String UNIX_ATTRIBUTES = "unix:mode,uid,gid,size,lastModifiedTime";
    private static final Comparator<Path> BY_NAME = Comparator.comparing(path -> path.getFileName().toString());

    private final int maxDepth;
    private final ExclusionPolicy exclusions;
    private final SnapshotCodec codec;

    public FilesystemSnapshotter() {
        this(DEFAULT_MAX_DEPTH, ExclusionPolicy.defaults(), new SnapshotCodec());
    }

    /**
     * Create a snapshotter.
     *
     * @param maxDepth number of directory levels below the root to descend into
     * @param exclusions paths to leave out
     * @param codec encoding of the artifact
     */
    public FilesystemSnapshotter(int maxDepth, @Nonnull ExclusionPolicy exclusions, @Nonnull SnapshotCodec codec) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Walk a directory tree without writing anything.
     *
     * @param sourceRoot directory to snapshot
     * @return snapshot tree and skipped paths
     * @throws NoSuchFileException if the source does not exist
     * @throws NotDirectoryException if the source is not a directory
     * @throws IOException if the source root cannot be resolved
     */
    @Nonnull
    public SnapshotResult walk(@Nonnull Path sourceRoot) throws IOException {
        return walk(sourceRoot, exclusions);
    }

    /**
     * Walk a directory tree and write the snapshot to a new file.
     *
     * <p>The artifact is encoded into a temporary file next to the output and
     * then moved into place, so the output path never holds a partial
     * artifact. If the output lies inside the source tree it is excluded from
     * the walk.</p>
     *
     * @param sourceRoot directory to snapshot
     * @param output artifact path, which must not exist
     * @return snapshot tree and skipped paths
     * @throws FileAlreadyExistsException if the output already exists; it is left untouched
     * @throws NoSuchFileException if the source does not exist
     * @throws NotDirectoryException if the source is not a directory
     * @throws IOException if encoding or writing fails
     */
    @Nonnull
    public SnapshotResult snapshot(@Nonnull Path sourceRoot, @Nonnull Path output) throws IOException {
        Objects.requireNonNull(output, "output");
        Path realRoot = requireDirectory(sourceRoot);
        if (Files.exists(output, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAlreadyExistsException(output.toString(), null, "Snapshot output already exists");
        }

        Path target = output.toAbsolutePath().normalize();
        Path parent = target.getParent();
        Files.createDirectories(parent);

        ExclusionPolicy effective = exclusions;
        Path realTarget = parent.toRealPath().resolve(target.getFileName());
        if (realTarget.startsWith(realRoot)) {
            String self = toVirtual(realRoot.relativize(realTarget));
            effective = exclusions.with(List.of(ExclusionPolicy.literal(self)));
        }

        SnapshotResult result = walk(realRoot, effective);

        Path temp = Files.createTempFile(parent, "." + target.getFileName() + ".", ".tmp");
        try {
            codec.write(SnapshotDocument.of(result.root()), temp);
            Files.move(temp, target);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        LOGGER.info("Wrote snapshot of {} to {} ({} entries, {} skipped)",
                sourceRoot, target, result.entryCount(), result.skipped().size());
        return result;
    }

    private SnapshotResult walk(Path sourceRoot, ExclusionPolicy policy) throws IOException {
        Path realRoot = requireDirectory(sourceRoot);
        LOGGER.debug("Walking {} (max depth {}, exclusions {})", realRoot, maxDepth, policy);

        Walk walk = new Walk(realRoot, policy);
        List<SnapshotEntry> children = walk.list(realRoot, "/", maxDepth);
        return new SnapshotResult(new DirectoryEntry(EntryMetadata.root(), children), walk.entries, walk.skipped);
    }

    private static Path requireDirectory(Path sourceRoot) throws IOException {
        Objects.requireNonNull(sourceRoot, "sourceRoot");
        if (!Files.exists(sourceRoot)) {
            throw new NoSuchFileException(sourceRoot.toString(), null, "Snapshot source does not exist");
        }
        if (!Files.isDirectory(sourceRoot)) {
            throw new NotDirectoryException(sourceRoot.toString());
        }
        return sourceRoot.toRealPath();
    }

    static String toVirtual(Path relative) {
        StringBuilder builder = new StringBuilder();
        for (Path segment : relative) {
            String name = segment.toString();
            if (!name.isEmpty()) {
                builder.append('/').append(name);
            }
        }
        return builder.length() == 0 ? "/" : builder.toString();
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    @Nonnull
    public ExclusionPolicy getExclusions() {
        return exclusions;
    }

    /**
     * State of one walk. Each call of {@link #list} owns the entries it
     * returns until its caller attaches them.
     */
    private static final class Walk {
        private final Path realRoot;
        private final ExclusionPolicy policy;
        private final List<SkippedPath> skipped = new ArrayList<>();
        private int entries;

        Walk(Path realRoot, ExclusionPolicy policy) {
            this.realRoot = realRoot;
            this.policy = policy;
        }

        List<SnapshotEntry> list(Path directory, String virtualDirectory, int depth) {
            if (depth == 0) {
                return List.of();
            }

            List<Path> items = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
                for (Path item : stream) {
                    items.add(item);
                }
            } catch (IOException e) {
                skip(virtualDirectory, SkippedPath.Reason.UNREADABLE_DIRECTORY, e);
                return List.of();
            } catch (DirectoryIteratorException e) {
                skip(virtualDirectory, SkippedPath.Reason.UNREADABLE_DIRECTORY, e.getCause());
                return List.of();
            }
            items.sort(BY_NAME);

            List<SnapshotEntry> children = new ArrayList<>(items.size());
            for (Path item : items) {
                String name = item.getFileName().toString();
                String virtualPath = virtualDirectory.equals("/") ? "/" + name : virtualDirectory + "/" + name;

                if (policy.matches(virtualPath)) {
                    skipped.add(new SkippedPath(virtualPath, SkippedPath.Reason.EXCLUDED, "matched exclusion pattern"));
                    LOGGER.debug("Excluded {}", virtualPath);
                    continue;
                }

                SnapshotEntry entry = entry(item, name, virtualPath, depth);
                if (entry != null) {
                    children.add(entry);
                    entries++;
                }
            }
            return children;
        }

        @Nullable
        private SnapshotEntry entry(Path item, String name, String virtualPath, int depth) {
            EntryMetadata metadata;
            try {
                metadata = readMetadata(item, name);
            } catch (IOException e) {
                skip(virtualPath, SkippedPath.Reason.STAT_FAILED, e);
                return null;
            }

            switch (metadata.type()) {
                case SYMLINK:
                    return link(item, metadata, virtualPath);
                case DIRECTORY:
                    return new DirectoryEntry(metadata, list(item, virtualPath, depth - 1));
                default:
                    return new LeafEntry(metadata);
            }
        }

        @Nullable
        private SnapshotEntry link(Path item, EntryMetadata metadata, String virtualPath) {
            Path target;
            try {
                target = item.toRealPath();
            } catch (IOException e) {
                skip(virtualPath, SkippedPath.Reason.UNRESOLVABLE_LINK, e);
                return null;
            }
            if (!target.startsWith(realRoot)) {
                skipped.add(new SkippedPath(virtualPath, SkippedPath.Reason.LINK_ESCAPES_ROOT,
                        "resolves outside the snapshot root"));
                LOGGER.warn("Skipping link {}: target lies outside the snapshot root", virtualPath);
                return null;
            }
            return new SymlinkEntry(metadata, toVirtual(realRoot.relativize(target)));
        }

        private void skip(String virtualPath, SkippedPath.Reason reason, Throwable cause) {
            String detail = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            skipped.add(new SkippedPath(virtualPath, reason, detail));
            LOGGER.warn("Skipping {} ({}): {}", virtualPath, reason, detail);
        }
    }

    private static EntryMetadata readMetadata(Path item, String name) throws IOException {
        Map<String, Object> attributes;
        try {
            attributes = Files.readAttributes(item, UNIX_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS);
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            return readPortableMetadata(item, name);
        }

        int mode = (Integer) attributes.get("mode");
        EntryType type = EntryType.fromMode(mode);
        if (type == null) {
            BasicFileAttributes basic = Files.readAttributes(item, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            type = classify(basic);
            LOGGER.debug("Unrecognised file type bits {} for {}, recorded as {}",
                    Integer.toOctalString(mode & EntryType.TYPE_MASK), item, type);
        }

        return new EntryMetadata(
                name,
                type,
                (Integer) attributes.get("uid"),
                (Integer) attributes.get("gid"),
                sizeOf(type, (Long) attributes.get("size")),
                mode,
                seconds((FileTime) attributes.get("lastModifiedTime")),
                null
        );
    }

    /**
     * Attributes for filesystems without the "unix" view. Owner ids are unknown
     * and recorded as 0; permission bits come from the "posix" view when present.
     */
    private static EntryMetadata readPortableMetadata(Path item, String name) throws IOException {
        BasicFileAttributes basic = Files.readAttributes(item, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        EntryType type = classify(basic);

        int permissions = 0;
        try {
            PosixFileAttributes posix = Files.readAttributes(item, PosixFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            permissions = permissionBits(posix.permissions());
        } catch (UnsupportedOperationException e) {
            LOGGER.trace("No posix attributes for {}", item);
        }

        return new EntryMetadata(name, type, 0, 0, sizeOf(type, basic.size()),
                type.modeBits() | permissions, seconds(basic.lastModifiedTime()), null);
    }

    private static EntryType classify(BasicFileAttributes attributes) {
        if (attributes.isSymbolicLink()) {
            return EntryType.SYMLINK;
        }
        if (attributes.isDirectory()) {
            return EntryType.DIRECTORY;
        }
        // Devices, sockets and fifos are indistinguishable here
        return EntryType.REGULAR_FILE;
    }

    private static long sizeOf(EntryType type, long size) {
        switch (type) {
            case REGULAR_FILE:
            case DIRECTORY:
            case SYMLINK:
                return size;
            default:
                return 0;
        }
    }

    private static long seconds(FileTime time) {
        return time.to(TimeUnit.SECONDS);
    }

    private static int permissionBits(Set<PosixFilePermission> permissions) {
        int bits = 0;
        for (PosixFilePermission permission : permissions) {
            // OWNER_READ is the highest bit, OTHERS_EXECUTE the lowest
            bits |= 1 << (8 - permission.ordinal());
        }
        return bits;
    }
}
