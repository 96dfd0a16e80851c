package io.blockstore.core.storage;

import io.blockstore.core.protocol.Digest;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic encoding of {@link BlockRecord} for the index column.
 * Layout: version(1) | id | height(8) | n | n * id | m | m * id,
 * where id = len(4) + multihash bytes and counts are 4-byte big-endian.
 */
public final class BlockRecordCodec {
    static final byte VERSION = 1;
    private static final int MAX_LINKS = 64;

    private BlockRecordCodec() {}

    public static byte[] encode(BlockRecord record) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(128);
        out.write(VERSION);
        writeDigest(out, record.id());
        writeLong(out, record.height());
        writeDigests(out, record.previousBlockIds());
        writeDigests(out, record.skipIds());
        return out.toByteArray();
    }

    public static BlockRecord decode(byte[] bytes) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            byte version = buf.get();
            if (version != VERSION) {
                throw new IllegalArgumentException("unsupported record version " + version);
            }
            Digest id = readDigest(buf);
            long height = buf.getLong();
            List<Digest> previous = readDigests(buf);
            List<Digest> skips = readDigests(buf);
            if (buf.hasRemaining()) {
                throw new IllegalArgumentException("trailing bytes in block record");
            }
            return new BlockRecord(id, height, previous, skips);
        } catch (RuntimeException ex) {
            throw new IllegalArgumentException("Malformed BlockRecord bytes", ex);
        }
    }

    private static void writeDigests(ByteArrayOutputStream out, List<Digest> digests) {
        writeInt(out, digests.size());
        for (Digest d : digests) {
            writeDigest(out, d);
        }
    }

    private static List<Digest> readDigests(ByteBuffer buf) {
        int count = buf.getInt();
        if (count < 0 || count > MAX_LINKS) {
            throw new IllegalArgumentException("bad link count: " + count);
        }
        List<Digest> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(readDigest(buf));
        }
        return out;
    }

    private static void writeDigest(ByteArrayOutputStream out, Digest digest) {
        byte[] encoded = digest.encode();
        writeInt(out, encoded.length);
        out.writeBytes(encoded);
    }

    private static Digest readDigest(ByteBuffer buf) {
        int len = buf.getInt();
        if (len <= 0 || len > buf.remaining()) {
            throw new IllegalArgumentException("bad digest length: " + len);
        }
        byte[] encoded = new byte[len];
        buf.get(encoded);
        return Digest.decode(encoded);
    }

    private static void writeInt(ByteArrayOutputStream out, int v) {
        out.writeBytes(ByteBuffer.allocate(4).putInt(v).array());
    }

    private static void writeLong(ByteArrayOutputStream out, long v) {
        out.writeBytes(ByteBuffer.allocate(8).putLong(v).array());
    }
}
