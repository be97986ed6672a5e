package io.stakechain.core.crypto;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.ECGenParameterSpec;

/**
 * secp256r1 key pair with a bech32 address. Used by the CLI demo and tests;
 * production signing is expected to come from an external key manager.
 */
public class Wallet implements Signer {
    private final KeyPair keyPair;
    private final String address;

    public Wallet(KeyPair keyPair, String addressPrefix) {
        this.keyPair = keyPair;
        this.address = Bech32Address.fromPublicKey(addressPrefix, keyPair.getPublic().getEncoded());
    }

    public static Wallet generate() {
        return generate(Bech32Address.DEFAULT_PREFIX);
    }

    public static Wallet generate(String addressPrefix) {
        try {
            KeyPairGenerator gen = KeyPairGenerator.getInstance("EC");
            gen.initialize(new ECGenParameterSpec("secp256r1"));
            return new Wallet(gen.generateKeyPair(), addressPrefix);
        } catch (GeneralSecurityException e) {
            throw new ChainException(ChainError.CRYPTO_ERROR, "EC key generation failed", e);
        }
    }

    @Override
    public String address() {
        return address;
    }

    @Override
    public byte[] publicKey() {
        return keyPair.getPublic().getEncoded();
    }

    public PrivateKey getPrivateKey() {
        return keyPair.getPrivate();
    }

    public PublicKey getPublicKey() {
        return keyPair.getPublic();
    }

    @Override
    public byte[] sign(byte[] data) {
        return SignatureUtil.sign(data, getPrivateKey());
    }

    public boolean verify(byte[] data, byte[] signature) {
        return SignatureUtil.verify(data, signature, getPublicKey());
    }
}
