package io.blockstore.core.protocol;

/**
 * Pure function from content to its identifier.
 * The store only compares the result against caller-supplied ids.
 */
@FunctionalInterface
public interface ContentHasher {

    Digest hash(byte[] content);

    static ContentHasher sha256() {
        return Hashes::sha256Digest;
    }
}
