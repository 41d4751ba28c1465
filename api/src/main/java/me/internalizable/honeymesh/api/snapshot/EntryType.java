package me.internalizable.honeymesh.api.snapshot;

import javax.annotation.Nullable;

/**
 * Kind of a node in a filesystem snapshot.
 *
 * <p>Each constant carries the numeric type code and the {@code st_mode}
 * file-type bits the honeypot runtime uses for the same kind.</p>
 */
public enum EntryType {
    /**
     * Symbolic link. Carries a link target, never children.
     */
    SYMLINK(0, 0120000),

    /**
     * Directory. The only kind that carries children.
     */
    DIRECTORY(1, 0040000),

    /**
     * Regular file. Only metadata is recorded, never contents.
     */
    REGULAR_FILE(2, 0100000),

    /**
     * Block special device.
     */
    BLOCK_DEVICE(3, 0060000),

    /**
     * Character special device.
     */
    CHAR_DEVICE(4, 0020000),

    /**
     * Unix domain socket.
     */
    SOCKET(5, 0140000),

    /**
     * Named pipe.
     */
    FIFO(6, 0010000);

    /**
     * Mask selecting the file-type bits of a mode.
     */
    public static final int TYPE_MASK = 0170000;

    private final int code;
    private final int modeBits;

    EntryType(int code, int modeBits) {
        this.code = code;
        this.modeBits = modeBits;
    }

    /**
     * Get the numeric type code understood by the honeypot runtime.
     *
     * @return type code
     */
    public int code() {
        return code;
    }

    /**
     * Get the file-type bits for this kind.
     *
     * @return bits under {@link #TYPE_MASK}
     */
    public int modeBits() {
        return modeBits;
    }

    /**
     * Classify a full {@code st_mode} value by its file-type bits.
     *
     * @param mode mode as reported by the filesystem
     * @return the matching type, or null if the bits name no known kind
     */
    @Nullable
    public static EntryType fromMode(int mode) {
        int bits = mode & TYPE_MASK;
        for (EntryType type : values()) {
            if (type.modeBits == bits) {
                return type;
            }
        }
        return null;
    }

    /**
     * Look up a type by its runtime code.
     *
     * @param code numeric type code
     * @return the matching type
     * @throws IllegalArgumentException if no type has this code
     */
    public static EntryType fromCode(int code) {
        for (EntryType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown entry type code: " + code);
    }
}
