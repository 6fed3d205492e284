package io.minichain.core.protocol;

import java.util.Arrays;

/**
 * 32-byte SHA-256 digest with value semantics.
 * The wire form is 64 lowercase hex characters.
 */
public final class Hash {
    public static final int LENGTH = 32;

    /** Predecessor sentinel of the genesis block. */
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final byte[] bytes;

    public Hash(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Hash must be 32 bytes");
        }
        this.bytes = bytes.clone();
    }

    public static Hash fromHex(String hex) {
        if (hex == null || hex.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Hash hex must be 64 characters");
        }
        byte[] out = new byte[LENGTH];
        for (int i = 0; i < out.length; i++) {
            int hi = Character.digit(hex.charAt(2 * i), 16);
            int lo = Character.digit(hex.charAt(2 * i + 1), 16);
            if (hi < 0 || lo < 0) {
                throw new IllegalArgumentException("Hash hex contains non-hex characters: " + hex);
            }
            out[i] = (byte) ((hi << 4) | lo);
        }
        return new Hash(out);
    }

    public byte[] bytes() { return bytes.clone(); }

    public String hex() {
        char[] out = new char[bytes.length * 2];
        for (int i = 0, j = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xff;
            out[j++] = HEX[v >>> 4];
            out[j++] = HEX[v & 0x0f];
        }
        return new String(out);
    }

    /** Number of leading zero nibbles, i.e. leading '0' characters of {@link #hex()}. */
    public int leadingZeroNibbles() {
        int n = 0;
        for (byte b : bytes) {
            int v = b & 0xff;
            if (v == 0) {
                n += 2;
                continue;
            }
            if ((v & 0xf0) == 0) n++;
            break;
        }
        return n;
    }

    public boolean isZero() { return equals(ZERO); }

    @Override public boolean equals(Object o){ return o instanceof Hash && Arrays.equals(bytes, ((Hash)o).bytes); }
    @Override public int hashCode(){ return Arrays.hashCode(bytes); }
    @Override public String toString(){ return "Hash("+hex().substring(0,8)+"…)"; }
}
