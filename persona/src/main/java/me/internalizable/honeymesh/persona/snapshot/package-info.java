/**
 * Filesystem snapshots for the honeypot runtime.
 *
 * <p>{@link me.internalizable.honeymesh.persona.snapshot.FilesystemSnapshotter}
 * walks a directory into the entry tree of
 * {@code me.internalizable.honeymesh.api.snapshot}, and
 * {@link me.internalizable.honeymesh.persona.snapshot.SnapshotCodec} stores it
 * as one JSON artifact.</p>
 */
package me.internalizable.honeymesh.persona.snapshot;
