package io.stakechain.core.crypto;

/**
 * Key holder able to sign on behalf of one address.
 */
public interface Signer {
    String address();

    /** Encoded public key matching {@link #address()}. */
    byte[] publicKey();

    byte[] sign(byte[] data);
}
