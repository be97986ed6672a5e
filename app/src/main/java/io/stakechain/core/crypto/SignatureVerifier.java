package io.stakechain.core.crypto;

/**
 * Stateless signature checks and address derivation.
 * Implementations report malformed key material through {@code deriveAddress}
 * as a {@code CRYPTO_ERROR}; {@code verify} simply answers false.
 */
public interface SignatureVerifier {
    boolean verify(byte[] data, byte[] signature, byte[] publicKey);

    String deriveAddress(byte[] publicKey);
}
