package io.stakechain.core.protocol;

import io.stakechain.core.crypto.SignatureUtil;
import io.stakechain.core.crypto.SignatureVerifier;
import io.stakechain.core.crypto.Signer;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Ordered batch of transactions committed by a Merkle root and sealed by proof of work.
 *
 * A block is assembled while unsealed: transactions may be added or removed and the
 * nonce advanced. {@link #seal()} freezes it; every later mutation is refused.
 */
public final class Block {
    private static final Logger LOG = Logger.getLogger(Block.class.getName());

    public static final long DEFAULT_GAS_LIMIT = 10_000_000L;
    public static final String GENESIS_PREVIOUS_HASH = "0";

    private final String id;
    private final long height;
    private final long timestamp;
    private final String previousHash;
    private final String validator;
    private final int maxTransactions;
    private final long gasLimit;
    private final List<Transaction> transactions;

    private String merkleRoot;
    private String hash;
    private long nonce;
    private int difficulty;
    private long gasUsed;
    private byte[] signature = new byte[0];
    private byte[] signerPublicKey = new byte[0];
    private boolean sealed;

    public Block(long height, long timestamp, String previousHash, String validator, int difficulty, int maxTransactions) {
        this(newId(), height, timestamp, previousHash, validator, difficulty, maxTransactions, DEFAULT_GAS_LIMIT);
    }

    private Block(String id, long height, long timestamp, String previousHash, String validator,
                  int difficulty, int maxTransactions, long gasLimit) {
        if (height < 0) throw new IllegalArgumentException("height must be >= 0");
        if (previousHash == null) throw new IllegalArgumentException("previousHash required");
        if (difficulty < 0) throw new IllegalArgumentException("difficulty must be >= 0");
        if (maxTransactions < 1) throw new IllegalArgumentException("maxTransactions must be >= 1");
        this.id = id;
        this.height = height;
        this.timestamp = timestamp;
        this.previousHash = previousHash;
        this.validator = validator;
        this.difficulty = difficulty;
        this.maxTransactions = maxTransactions;
        this.gasLimit = gasLimit;
        this.transactions = new ArrayList<>();
        this.merkleRoot = Merkle.EMPTY_ROOT;
        this.hash = computeHash();
    }

    /** Height-0 block with no transactions, difficulty 0 and previous hash "0"; already sealed. */
    public static Block genesis(long timestamp, int maxTransactions) {
        Block b = new Block(0, timestamp, GENESIS_PREVIOUS_HASH, null, 0, maxTransactions);
        b.seal();
        return b;
    }

    // -------------------- getters --------------------
    public String id() { return id; }
    public long height() { return height; }
    public long timestamp() { return timestamp; }
    public String previousHash() { return previousHash; }
    public String validator() { return validator; }
    public String merkleRoot() { return merkleRoot; }
    public String hash() { return hash; }
    public long nonce() { return nonce; }
    public int difficulty() { return difficulty; }
    public long gasUsed() { return gasUsed; }
    public long gasLimit() { return gasLimit; }
    public int maxTransactions() { return maxTransactions; }
    public byte[] signature() { return signature.clone(); }
    public byte[] signerPublicKey() { return signerPublicKey.clone(); }
    public boolean isSealed() { return sealed; }
    public List<Transaction> transactions() { return Collections.unmodifiableList(transactions); }

    // -------------------- assembly (pre-seal only) --------------------

    public boolean addTransaction(Transaction tx) {
        return addTransaction(tx, SignatureUtil.verifier());
    }

    /** Returns false when sealed, full, invalid or already contained (by id). */
    public boolean addTransaction(Transaction tx, SignatureVerifier verifier) {
        if (sealed || tx == null) return false;
        if (transactions.size() >= maxTransactions) {
            LOG.fine(() -> "Block " + id + " is full");
            return false;
        }
        if (!tx.isValid(verifier)) return false;
        for (Transaction t : transactions) {
            if (t.id().equals(tx.id())) return false;
        }
        transactions.add(tx);
        refreshCommitments();
        return true;
    }

    public boolean removeTransaction(String txId) {
        if (sealed || txId == null) return false;
        boolean removed = transactions.removeIf(t -> t.id().equals(txId));
        if (removed) refreshCommitments();
        return removed;
    }

    public void setDifficulty(int difficulty) {
        ensureUnsealed();
        if (difficulty < 0) throw new IllegalArgumentException("difficulty must be >= 0");
        this.difficulty = difficulty;
        this.hash = computeHash();
    }

    /** Next nonce candidate; returns the new hash. */
    public String advanceNonce() {
        ensureUnsealed();
        nonce++;
        hash = computeHash();
        return hash;
    }

    public void seal() {
        hash = computeHash();
        sealed = true;
    }

    /** Validator-authored signature over the sealed hash. */
    public void sign(Signer signer) {
        if (!sealed) throw new IllegalStateException("Block must be sealed before signing");
        if (signer == null || validator == null || !validator.equals(signer.address())) {
            throw new ChainException(ChainError.ADDRESS_MISMATCH,
                    "Signer " + (signer == null ? null : signer.address()) + " is not block validator " + validator);
        }
        this.signature = signer.sign(hash.getBytes(StandardCharsets.UTF_8));
        this.signerPublicKey = signer.publicKey();
    }

    private void ensureUnsealed() {
        if (sealed) throw new IllegalStateException("Block " + id + " is sealed");
    }

    private void refreshCommitments() {
        merkleRoot = computeMerkleRoot();
        long g = 0;
        for (Transaction t : transactions) g += t.fee();
        gasUsed = g;
        hash = computeHash();
    }

    // -------------------- commitments --------------------

    public String computeMerkleRoot() {
        List<String> leaves = new ArrayList<>(transactions.size());
        for (Transaction tx : transactions) leaves.add(tx.hash() == null ? "" : tx.hash());
        return Merkle.rootOf(leaves);
    }

    public String computeHash() {
        byte[] idB = utf8(id);
        byte[] prevB = utf8(previousHash);
        byte[] rootB = utf8(merkleRoot);
        byte[] valB = utf8(validator);
        ByteBuffer buf = ByteBuffer.allocate(4 + idB.length + 8 + 4 + prevB.length + 4 + rootB.length
                + 4 + valB.length + 8 + 8 + 4);
        putBytes(buf, idB);
        buf.putLong(timestamp);
        putBytes(buf, prevB);
        putBytes(buf, rootB);
        putBytes(buf, valB);
        buf.putLong(height);
        buf.putLong(nonce);
        buf.putInt(difficulty);
        buf.flip();
        byte[] out = new byte[buf.remaining()];
        buf.get(out);
        return Hashes.sha256Hex(out);
    }

    /** Leading zero hex digits; difficulty 0 accepts any hash. */
    public static boolean meetsTarget(String hash, int difficulty) {
        if (hash == null || hash.length() < difficulty) return false;
        for (int i = 0; i < difficulty; i++) {
            if (hash.charAt(i) != '0') return false;
        }
        return true;
    }

    public boolean isValid() {
        return isValid(maxTransactions, SignatureUtil.verifier());
    }

    /** Hash, target, Merkle root, size, every transaction and, when present, the signature. */
    public boolean isValid(int maxTxPerBlock, SignatureVerifier verifier) {
        if (!computeHash().equals(hash)) {
            LOG.fine(() -> "Hash mismatch in block " + height);
            return false;
        }
        if (!meetsTarget(hash, difficulty)) {
            LOG.fine(() -> "Block " + height + " misses target " + difficulty);
            return false;
        }
        if (!computeMerkleRoot().equals(merkleRoot)) {
            LOG.fine(() -> "Merkle root mismatch in block " + height);
            return false;
        }
        if (transactions.size() > maxTxPerBlock) return false;
        for (Transaction tx : transactions) {
            if (!tx.isValid(verifier)) return false;
        }
        if (signature.length > 0) {
            try {
                if (!validator.equals(verifier.deriveAddress(signerPublicKey))) return false;
                return verifier.verify(hash.getBytes(StandardCharsets.UTF_8), signature, signerPublicKey);
            } catch (ChainException e) {
                LOG.fine(() -> "Block signature key rejected: " + e.getMessage());
                return false;
            }
        }
        return true;
    }

    // -------------------- restore --------------------

    public static Builder builder() { return new Builder(); }

    /** Rebuilds a sealed block verbatim, e.g. from a snapshot. Commitments are taken as given. */
    public static final class Builder {
        private String id;
        private long height;
        private long timestamp;
        private String previousHash = GENESIS_PREVIOUS_HASH;
        private String validator;
        private int difficulty;
        private int maxTransactions = 1000;
        private long gasLimit = DEFAULT_GAS_LIMIT;
        private List<Transaction> transactions = List.of();
        private String merkleRoot;
        private String hash;
        private long nonce;
        private long gasUsed;
        private byte[] signature;
        private byte[] signerPublicKey;

        public Builder from(Block b) {
            id = b.id; height = b.height; timestamp = b.timestamp; previousHash = b.previousHash;
            validator = b.validator; difficulty = b.difficulty; maxTransactions = b.maxTransactions;
            gasLimit = b.gasLimit; transactions = new ArrayList<>(b.transactions); merkleRoot = b.merkleRoot;
            hash = b.hash; nonce = b.nonce; gasUsed = b.gasUsed; signature = b.signature; signerPublicKey = b.signerPublicKey;
            return this;
        }
        public Builder id(String v) { this.id = v; return this; }
        public Builder height(long v) { this.height = v; return this; }
        public Builder timestamp(long v) { this.timestamp = v; return this; }
        public Builder previousHash(String v) { this.previousHash = v; return this; }
        public Builder validator(String v) { this.validator = v; return this; }
        public Builder difficulty(int v) { this.difficulty = v; return this; }
        public Builder maxTransactions(int v) { this.maxTransactions = v; return this; }
        public Builder gasLimit(long v) { this.gasLimit = v; return this; }
        public Builder transactions(List<Transaction> v) { this.transactions = v == null ? List.of() : v; return this; }
        public Builder merkleRoot(String v) { this.merkleRoot = v; return this; }
        public Builder hash(String v) { this.hash = v; return this; }
        public Builder nonce(long v) { this.nonce = v; return this; }
        public Builder gasUsed(long v) { this.gasUsed = v; return this; }
        public Builder signature(byte[] v) { this.signature = v; return this; }
        public Builder signerPublicKey(byte[] v) { this.signerPublicKey = v; return this; }

        public Block build() {
            Block b = new Block(id != null ? id : newId(), height, timestamp, previousHash, validator,
                    difficulty, maxTransactions, gasLimit);
            b.transactions.addAll(transactions);
            b.nonce = nonce;
            b.merkleRoot = merkleRoot != null ? merkleRoot : b.computeMerkleRoot();
            b.gasUsed = gasUsed;
            b.hash = hash != null ? hash : b.computeHash();
            b.signature = signature != null ? signature.clone() : new byte[0];
            b.signerPublicKey = signerPublicKey != null ? signerPublicKey.clone() : new byte[0];
            b.sealed = true;
            return b;
        }
    }

    private static String newId() {
        return "blk_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static byte[] utf8(String s) {
        return s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
    }

    private static void putBytes(ByteBuffer buf, byte[] b) {
        buf.putInt(b.length); buf.put(b);
    }

    @Override public String toString() {
        return "Block{height=" + height + ", txs=" + transactions.size() + ", hash=" + hash + "}";
    }
}
