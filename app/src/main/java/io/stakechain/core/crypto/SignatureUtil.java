package io.stakechain.core.crypto;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;

/**
 * SHA256withECDSA signing and verification over X.509-encoded EC public keys.
 */
public final class SignatureUtil implements SignatureVerifier {
    private static final String ALGORITHM = "SHA256withECDSA";
    private static final SignatureUtil DEFAULT = new SignatureUtil(Bech32Address.DEFAULT_PREFIX);

    private final String addressPrefix;

    public SignatureUtil(String addressPrefix) {
        if (addressPrefix == null || addressPrefix.isBlank()) {
            throw new IllegalArgumentException("address prefix required");
        }
        this.addressPrefix = addressPrefix;
    }

    public static SignatureUtil verifier() { return DEFAULT; }

    public String addressPrefix() { return addressPrefix; }

    public static byte[] sign(byte[] data, PrivateKey priv) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initSign(priv);
            sig.update(data);
            return sig.sign();
        } catch (GeneralSecurityException e) {
            throw new ChainException(ChainError.CRYPTO_ERROR, "Signing failed", e);
        }
    }

    public static boolean verify(byte[] data, byte[] signature, PublicKey pub) {
        try {
            Signature sig = Signature.getInstance(ALGORITHM);
            sig.initVerify(pub);
            sig.update(data);
            return sig.verify(signature);
        } catch (GeneralSecurityException e) {
            return false;
        }
    }

    public static PublicKey decodePublicKey(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new ChainException(ChainError.CRYPTO_ERROR, "Missing public key");
        }
        try {
            return KeyFactory.getInstance("EC").generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new ChainException(ChainError.CRYPTO_ERROR, "Malformed public key", e);
        }
    }

    @Override
    public boolean verify(byte[] data, byte[] signature, byte[] publicKey) {
        if (signature == null || signature.length == 0) return false;
        PublicKey pub;
        try {
            pub = decodePublicKey(publicKey);
        } catch (ChainException e) {
            return false;
        }
        return verify(data, signature, pub);
    }

    @Override
    public String deriveAddress(byte[] publicKey) {
        decodePublicKey(publicKey);
        return Bech32Address.fromPublicKey(addressPrefix, publicKey);
    }
}
