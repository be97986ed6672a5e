package io.stakechain.core.protocol;

import io.stakechain.core.crypto.Wallet;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TransactionTest {

    @Test
    void plainTransferPaysBaseFee() {
        Transaction tx = Transaction.transfer("wtf1a", "wtf1b", 100);
        assertEquals(1, tx.fee());
        assertEquals(101, tx.requiredFunds());
        assertNull(tx.hash());
    }

    @Test
    void feeScalesWithTypeAndPayload() {
        Transaction tx = Transaction.createValidator("wtf1a", 1000, 0.1, "a validator");
        long payloadBytes = Transaction.payloadSize(tx.payload());
        assertTrue(payloadBytes > 0);
        assertEquals(5 + (payloadBytes + 99) / 100, tx.fee());
    }

    @Test
    void signedTransferIsValid() {
        Wallet alice = Wallet.generate();
        Transaction tx = Transaction.transfer(alice.address(), "wtf1bob", 10);
        tx.sign(alice);

        assertNotNull(tx.hash());
        assertTrue(tx.isSigned());
        assertTrue(tx.isValid());
        assertTrue(tx.isValid(), "validation is repeatable");
    }

    @Test
    void signingWithForeignKeyIsAddressMismatch() {
        Wallet alice = Wallet.generate();
        Wallet mallory = Wallet.generate();
        Transaction tx = Transaction.transfer(alice.address(), "wtf1bob", 10);

        ChainException ex = assertThrows(ChainException.class, () -> tx.sign(mallory));
        assertEquals(ChainError.ADDRESS_MISMATCH, ex.error());
        assertFalse(tx.isSigned());
        assertFalse(tx.isValid());
    }

    @Test
    void nonceIsPartOfTheSignedHash() {
        Wallet alice = Wallet.generate();
        Transaction tx = Transaction.transfer(alice.address(), "wtf1bob", 10);
        tx.setNonce(3);
        String unsignedHash = tx.computeHash();
        tx.sign(alice);

        assertEquals(3, tx.nonce());
        assertEquals(unsignedHash, tx.hash());
        assertThrows(IllegalStateException.class, () -> tx.setNonce(4));
        assertThrows(IllegalStateException.class, () -> Transaction.miningReward("wtf1miner", 50).setNonce(1));
        assertThrows(IllegalArgumentException.class, () -> Transaction.transfer("wtf1a", "wtf1b", 1).setNonce(-1));
    }

    @Test
    void unsignedTransactionIsInvalid() {
        assertFalse(Transaction.transfer("wtf1a", "wtf1b", 10).isValid());
    }

    @Test
    void tamperedAmountBreaksHash() {
        Wallet alice = Wallet.generate();
        Transaction tx = Transaction.transfer(alice.address(), "wtf1bob", 10);
        tx.sign(alice);

        Transaction forged = Transaction.builder()
                .id(tx.id()).from(tx.fromAddress()).to(tx.toAddress()).amount(1_000)
                .type(tx.type()).fee(tx.fee()).timestamp(tx.timestamp()).nonce(tx.nonce())
                .hash(tx.hash()).signature(tx.signature()).publicKey(tx.publicKey())
                .build();
        assertFalse(forged.isValid());
    }

    @Test
    void zeroAmountOnlyForExemptTypes() {
        Wallet alice = Wallet.generate();
        Transaction transfer = Transaction.transfer(alice.address(), "wtf1bob", 0);
        transfer.sign(alice);
        assertFalse(transfer.isValid());

        Transaction vote = Transaction.vote(alice.address(), 1, "yes");
        vote.sign(alice);
        assertTrue(vote.isValid());
        assertNull(vote.toAddress());
        assertEquals("1", vote.payloadValue("proposalId"));
    }

    @Test
    void miningRewardNeedsNoSignature() {
        Transaction reward = Transaction.miningReward("wtf1miner", 50);
        assertTrue(reward.isProtocolMinted());
        assertTrue(reward.isValid());
        assertEquals(0, reward.requiredFunds());

        ChainException ex = assertThrows(ChainException.class, () -> reward.sign(Wallet.generate()));
        assertEquals(ChainError.INVALID_TRANSACTION, ex.error());
    }

    @Test
    void rewardWithoutAmountIsInvalid() {
        Transaction reward = Transaction.miningReward("wtf1miner", 0);
        assertFalse(reward.isValid());
    }

    @Test
    void undelegationDoesNotDebitAmount() {
        Transaction tx = Transaction.undelegation("wtf1a", "wtf1val", 500);
        assertEquals(tx.fee(), tx.requiredFunds());
        assertEquals("wtf1val", tx.payloadValue("validator"));
    }

    @Test
    void proposalContentIsFlattened() {
        Transaction tx = Transaction.submitProposal("wtf1a", "Raise reward", "more", "parameter_change",
                Map.of("module", "blockchain", "parameter", "miningReward", "value", "60"), 1000);
        assertEquals("blockchain", tx.payloadValue("content.module"));
        assertEquals(1000, tx.amount());
        assertTrue(tx.fee() > TransactionType.SUBMIT_PROPOSAL.feeMultiplier());
    }

    @Test
    void expiresAfterMaxAge() {
        Transaction tx = Transaction.builder().from("wtf1a").to("wtf1b").amount(1).timestamp(1_000).build();
        assertFalse(tx.isExpired(1_500, 1_000));
        assertTrue(tx.isExpired(2_001, 1_000));
    }
}
