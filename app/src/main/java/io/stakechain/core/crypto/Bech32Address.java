package io.stakechain.core.crypto;

import io.stakechain.core.protocol.Hashes;
import org.bitcoinj.core.Bech32;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;

/**
 * Human-readable addresses: bech32(prefix, first 20 bytes of SHA-256(publicKey)).
 */
public final class Bech32Address {
    public static final String DEFAULT_PREFIX = "wtf";
    private static final int ADDRESS_BYTES = 20;

    private Bech32Address() {}

    public static String fromPublicKey(String prefix, byte[] publicKey) {
        if (publicKey == null || publicKey.length == 0) {
            throw new IllegalArgumentException("public key required");
        }
        byte[] digest = Arrays.copyOf(Hashes.sha256(publicKey), ADDRESS_BYTES);
        return Bech32.encode(Bech32.Encoding.BECH32, prefix, convertBits(digest, 8, 5, true));
    }

    public static boolean isValid(String prefix, String address) {
        if (address == null || address.isBlank()) return false;
        try {
            Bech32.Bech32Data data = Bech32.decode(address);
            return data.hrp.equals(prefix) && convertBits(data.data, 5, 8, false).length == ADDRESS_BYTES;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Regroups bits between word sizes (8 -> 5 for encoding, 5 -> 8 for decoding). */
    static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxV = (1 << toBits) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(in.length * fromBits / toBits + 1);
        for (byte b : in) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("input value out of range: " + value);
            }
            acc = (acc << fromBits) | value;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxV);
            }
        }
        if (pad) {
            if (bits > 0) out.write((acc << (toBits - bits)) & maxV);
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxV) != 0) {
            throw new IllegalArgumentException("could not convert bits, invalid padding");
        }
        return out.toByteArray();
    }
}
