package io.stakechain.core.crypto;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WalletTest {

    @Test
    void addressIsBech32OfPublicKey() {
        Wallet wallet = Wallet.generate();
        assertTrue(wallet.address().startsWith("wtf1"));
        assertTrue(Bech32Address.isValid("wtf", wallet.address()));
        assertEquals(wallet.address(), SignatureUtil.verifier().deriveAddress(wallet.publicKey()));
    }

    @Test
    void customPrefix() {
        Wallet wallet = Wallet.generate("stake");
        assertTrue(wallet.address().startsWith("stake1"));
        assertFalse(Bech32Address.isValid("wtf", wallet.address()));
        assertEquals(wallet.address(), new SignatureUtil("stake").deriveAddress(wallet.publicKey()));
    }

    @Test
    void signatureVerifiesOnlyForSignedData() {
        Wallet wallet = Wallet.generate();
        byte[] data = "block-hash".getBytes(StandardCharsets.UTF_8);
        byte[] sig = wallet.sign(data);

        assertTrue(wallet.verify(data, sig));
        assertTrue(SignatureUtil.verifier().verify(data, sig, wallet.publicKey()));
        assertFalse(SignatureUtil.verifier().verify("other".getBytes(StandardCharsets.UTF_8), sig, wallet.publicKey()));
        assertFalse(SignatureUtil.verifier().verify(data, sig, Wallet.generate().publicKey()));
    }

    @Test
    void corruptedAddressIsRejected() {
        String address = Wallet.generate().address();
        char last = address.charAt(address.length() - 1);
        String corrupted = address.substring(0, address.length() - 1) + (last == 'q' ? 'p' : 'q');
        assertFalse(Bech32Address.isValid("wtf", corrupted));
        assertFalse(Bech32Address.isValid("wtf", "not-an-address"));
        assertFalse(Bech32Address.isValid("wtf", "wtf1"));
        assertFalse(Bech32Address.isValid("wtf", address.toUpperCase().substring(0, 10) + address.substring(10)));
    }
}
