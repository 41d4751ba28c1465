/**
 * Filesystem snapshot tree shared with the honeypot runtime.
 *
 * <p>A snapshot is a {@link me.internalizable.honeymesh.api.snapshot.SnapshotDocument}
 * whose root is a directory named "/". Nodes record structure and metadata
 * only; file contents are never embedded.</p>
 *
 * @see me.internalizable.honeymesh.api.snapshot.SnapshotEntry
 */
package me.internalizable.honeymesh.api.snapshot;
