package io.blockstore.core.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Content identifier: a multihash algorithm code plus the raw digest bytes.
 *
 * Equality and ordering are byte-wise (code first, then digest, unsigned).
 * The binary form is the multihash encoding varint(code) || varint(len) || digest,
 * and the text form is that encoding in lowercase hex.
 */
public final class Digest implements Comparable<Digest> {
    public static final long SHA2_256 = 0x12;
    public static final int MAX_DIGEST_LENGTH = 128;

    private static final Digest ZERO = new Digest(SHA2_256, new byte[32]);

    private final long code;
    private final byte[] bytes;
    private final int hash; // cache hashCode

    public Digest(long code, byte[] bytes) {
        if (code < 0) {
            throw new IllegalArgumentException("Multihash code must be non-negative");
        }
        if (bytes == null) {
            throw new IllegalArgumentException("Digest bytes required");
        }
        if (bytes.length > MAX_DIGEST_LENGTH) {
            throw new IllegalArgumentException("Digest too long: " + bytes.length);
        }
        this.code = code;
        this.bytes = bytes.clone();
        this.hash = 31 * Long.hashCode(code) + Arrays.hashCode(this.bytes);
    }

    /** The all-zero SHA2-256 digest used as "no previous block". */
    public static Digest zero() {
        return ZERO;
    }

    public static Digest sha256(byte[] digest) {
        if (digest == null || digest.length != 32) {
            throw new IllegalArgumentException("SHA2-256 digest must be 32 bytes");
        }
        return new Digest(SHA2_256, digest);
    }

    public long code() { return code; }
    public byte[] bytes() { return bytes.clone(); }
    public int length() { return bytes.length; }

    /** True when every digest byte is zero, whatever the algorithm code. */
    public boolean isZero() {
        for (byte b : bytes) {
            if (b != 0) return false;
        }
        return true;
    }

    /** Multihash encoding. */
    public byte[] encode() {
        ByteArrayOutputStream out = new ByteArrayOutputStream(bytes.length + 4);
        writeVarint(out, code);
        writeVarint(out, bytes.length);
        out.writeBytes(bytes);
        return out.toByteArray();
    }

    public static Digest decode(byte[] encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("Encoded digest required");
        }
        ByteBuffer buf = ByteBuffer.wrap(encoded);
        Digest digest = read(buf);
        if (buf.hasRemaining()) {
            throw new IllegalArgumentException("Trailing bytes after multihash");
        }
        return digest;
    }

    /** Read one multihash from the buffer, advancing its position. */
    public static Digest read(ByteBuffer buf) {
        try {
            long code = readVarint(buf);
            long len = readVarint(buf);
            if (len > MAX_DIGEST_LENGTH) {
                throw new IllegalArgumentException("bad digest length: " + len);
            }
            byte[] digest = new byte[(int) len];
            buf.get(digest);
            return new Digest(code, digest);
        } catch (RuntimeException ex) {
            if (ex instanceof IllegalArgumentException iae) throw iae;
            throw new IllegalArgumentException("Malformed multihash", ex);
        }
    }

    @JsonValue
    public String hex() { return Hex.encode(encode()); }

    @JsonCreator
    public static Digest fromHex(String hex) {
        return decode(Hex.decode(hex));
    }

    @Override
    public int compareTo(Digest o) {
        int c = Long.compareUnsigned(code, o.code);
        if (c != 0) return c;
        return Arrays.compareUnsigned(bytes, o.bytes);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Digest)) return false;
        Digest other = (Digest) o;
        return code == other.code && Arrays.equals(bytes, other.bytes);
    }

    @Override public int hashCode() { return hash; }

    @Override public String toString() {
        String digestHex = Hex.encode(bytes);
        return "Digest(" + (digestHex.length() > 8 ? digestHex.substring(0, 8) + "…" : digestHex) + ")";
    }

    private static void writeVarint(ByteArrayOutputStream out, long value) {
        long v = value;
        while ((v & ~0x7FL) != 0) {
            out.write((int) ((v & 0x7F) | 0x80));
            v >>>= 7;
        }
        out.write((int) v);
    }

    private static long readVarint(ByteBuffer buf) {
        long result = 0;
        for (int shift = 0; shift < 64; shift += 7) {
            byte b = buf.get();
            result |= (long) (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IllegalArgumentException("varint too long");
    }
}
