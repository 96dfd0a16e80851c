package io.blockstore.core.storage;

/**
 * Height arithmetic for ancestor shortcuts.
 *
 * A block at height {@code h > 0} links to the ancestors at heights
 * {@code h - 2^i} for {@code i = 0 .. trailingZeros(h)}; entry 0 is the parent.
 * e.g. 8 → [7, 6, 4, 0], 12 → [11, 10, 8], 7 → [6].
 */
public final class SkipList {
    private SkipList() {}

    public static long[] previousHeights(long height) {
        if (height < 0) {
            throw new IllegalArgumentException("negative height " + height);
        }
        if (height == 0) {
            return new long[0];
        }
        int zeros = Long.numberOfTrailingZeros(height);
        long[] out = new long[zeros + 1];
        for (int i = 0; i <= zeros; i++) {
            out[i] = height - (1L << i);
        }
        return out;
    }

    /**
     * Index into {@link #previousHeights(long) previousHeights(current)} of the
     * longest jump that does not pass below {@code goal}.
     *
     * @throws IllegalArgumentException unless {@code 0 <= goal < current}
     */
    public static int jumpIndex(long current, long goal) {
        if (goal < 0 || goal >= current) {
            throw new IllegalArgumentException("goal " + goal + " must be below " + current);
        }
        int zeros = Long.numberOfTrailingZeros(current);
        int best = 0;
        for (int i = 1; i <= zeros; i++) {
            if (current - (1L << i) < goal) {
                break;
            }
            best = i;
        }
        return best;
    }

    /** Height reached from {@code current} through skip entry {@code index}. */
    public static long heightAt(long current, int index) {
        return current - (1L << index);
    }
}
