package io.stakechain.core.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stakechain.core.crypto.SignatureUtil;
import io.stakechain.core.crypto.SignatureVerifier;
import io.stakechain.core.crypto.Signer;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Value transfer or staking/governance action.
 *
 * A transaction is created unsigned, stamped with the sender's next nonce, then
 * {@link #sign(Signer)} fixes its hash, signature and public key. Protocol-minted transactions (mining rewards) have no
 * sender and are hashed at creation.
 */
public final class Transaction {
    private static final Logger LOG = Logger.getLogger(Transaction.class.getName());
    private static final ObjectMapper JSON = new ObjectMapper();

    public static final int BASE_FEE = 1;
    public static final int FEE_BYTES_PER_UNIT = 100;

    private final String id;
    private final String fromAddress;
    private final String toAddress;
    private final long amount;
    private final TransactionType type;
    private final SortedMap<String, String> payload;
    private final long fee;
    private final long timestamp;
    private long nonce;

    private String hash;
    private byte[] signature;
    private byte[] publicKey;

    private Transaction(Builder b) {
        if (b.type == null) throw new IllegalArgumentException("Missing type");
        if (b.amount < 0) throw new IllegalArgumentException("amount must be >= 0");
        this.id = b.id != null ? b.id : newId();
        this.fromAddress = blankToNull(b.fromAddress);
        this.toAddress = blankToNull(b.toAddress);
        this.amount = b.amount;
        this.type = b.type;
        this.payload = Collections.unmodifiableSortedMap(new TreeMap<>(b.payload));
        this.timestamp = b.timestamp;
        this.nonce = b.nonce;
        this.fee = b.fee != null ? b.fee : calculateFee(type, payload);
        this.hash = b.hash;
        this.signature = b.signature != null ? b.signature.clone() : new byte[0];
        this.publicKey = b.publicKey != null ? b.publicKey.clone() : new byte[0];
    }

    public static Builder builder() { return new Builder(); }

    /** Restores every field verbatim (used by snapshot import). */
    public static final class Builder {
        private String id;
        private String fromAddress;
        private String toAddress;
        private long amount;
        private TransactionType type = TransactionType.TRANSFER;
        private final SortedMap<String, String> payload = new TreeMap<>();
        private Long fee;
        private long timestamp = System.currentTimeMillis();
        private long nonce;
        private String hash;
        private byte[] signature;
        private byte[] publicKey;

        public Builder id(String v) { this.id = v; return this; }
        public Builder from(String v) { this.fromAddress = v; return this; }
        public Builder to(String v) { this.toAddress = v; return this; }
        public Builder amount(long v) { this.amount = v; return this; }
        public Builder type(TransactionType v) { this.type = v; return this; }
        public Builder payload(Map<String, String> p) {
            this.payload.clear();
            if (p != null) this.payload.putAll(p);
            return this;
        }
        public Builder put(String key, String value) { this.payload.put(key, value); return this; }
        public Builder fee(long v) { this.fee = v; return this; }
        public Builder timestamp(long v) { this.timestamp = v; return this; }
        public Builder nonce(long v) { this.nonce = v; return this; }
        public Builder hash(String v) { this.hash = v; return this; }
        public Builder signature(byte[] v) { this.signature = v; return this; }
        public Builder publicKey(byte[] v) { this.publicKey = v; return this; }

        public Transaction build() { return new Transaction(this); }
    }

    // -------------------- factories --------------------

    public static Transaction create(String from, String to, long amount, TransactionType type, Map<String, String> payload) {
        return builder().from(from).to(to).amount(amount).type(type).payload(payload).build();
    }

    public static Transaction transfer(String from, String to, long amount) {
        return create(from, to, amount, TransactionType.TRANSFER, Map.of());
    }

    public static Transaction miningReward(String minerAddress, long reward) {
        Transaction tx = builder().to(minerAddress).amount(reward).type(TransactionType.MINING_REWARD).build();
        tx.hash = tx.computeHash();
        return tx;
    }

    public static Transaction delegation(String delegator, String validator, long amount) {
        return create(delegator, validator, amount, TransactionType.DELEGATE, Map.of("validator", validator));
    }

    public static Transaction undelegation(String delegator, String validator, long amount) {
        return create(delegator, validator, amount, TransactionType.UNDELEGATE, Map.of("validator", validator));
    }

    public static Transaction redelegation(String delegator, String srcValidator, String dstValidator, long amount) {
        return create(delegator, srcValidator, amount, TransactionType.REDELEGATE,
                Map.of("validator", srcValidator, "destination", dstValidator));
    }

    public static Transaction vote(String voter, long proposalId, String option) {
        return create(voter, null, 0, TransactionType.VOTE,
                Map.of("proposalId", Long.toString(proposalId), "option", option));
    }

    public static Transaction createValidator(String operator, long selfStake, double commission, String description) {
        return create(operator, null, selfStake, TransactionType.CREATE_VALIDATOR,
                Map.of("commission", Double.toString(commission), "description", description == null ? "" : description));
    }

    public static Transaction editValidator(String operator, Double commission, String description) {
        SortedMap<String, String> p = new TreeMap<>();
        if (commission != null) p.put("commission", Double.toString(commission));
        if (description != null) p.put("description", description);
        return create(operator, null, 0, TransactionType.EDIT_VALIDATOR, p);
    }

    /**
     * Proposal submission; {@code initialDeposit} travels as the amount and
     * {@code content} entries are flattened under a {@code content.} prefix.
     */
    public static Transaction submitProposal(String proposer, String title, String description, String proposalType,
                                             Map<String, String> content, long initialDeposit) {
        SortedMap<String, String> p = new TreeMap<>();
        p.put("title", title == null ? "" : title);
        p.put("description", description == null ? "" : description);
        p.put("proposalType", proposalType == null ? "" : proposalType);
        if (content != null) {
            content.forEach((k, v) -> p.put("content." + k, v));
        }
        return create(proposer, null, initialDeposit, TransactionType.SUBMIT_PROPOSAL, p);
    }

    public static Transaction deposit(String depositor, long proposalId, long amount) {
        return create(depositor, null, amount, TransactionType.DEPOSIT, Map.of("proposalId", Long.toString(proposalId)));
    }

    // -------------------- getters --------------------
    public String id() { return id; }
    public String fromAddress() { return fromAddress; }
    public String toAddress() { return toAddress; }
    public long amount() { return amount; }
    public TransactionType type() { return type; }
    public Map<String, String> payload() { return payload; }
    public String payloadValue(String key) { return payload.get(key); }
    public long fee() { return fee; }
    public long timestamp() { return timestamp; }
    public long nonce() { return nonce; }
    public String hash() { return hash; }
    public byte[] signature() { return signature.clone(); }
    public byte[] publicKey() { return publicKey.clone(); }

    public boolean isProtocolMinted() { return fromAddress == null; }

    public boolean isSigned() { return signature.length > 0; }

    /** Liquid funds the sender needs for this transaction to apply. */
    public long requiredFunds() {
        if (isProtocolMinted()) return 0L;
        return (type.debitsAmount() ? amount : 0L) + fee;
    }

    // -------------------- core methods --------------------

    /** base fee x type multiplier + ceil(payload bytes / 100). */
    public static long calculateFee(TransactionType type, Map<String, String> payload) {
        long dataBytes = payloadSize(payload);
        long dataFee = (dataBytes + FEE_BYTES_PER_UNIT - 1) / FEE_BYTES_PER_UNIT;
        return (long) BASE_FEE * type.feeMultiplier() + dataFee;
    }

    static long payloadSize(Map<String, String> payload) {
        if (payload == null || payload.isEmpty()) return 0L;
        return canonicalPayload(payload).getBytes(StandardCharsets.UTF_8).length;
    }

    private static String canonicalPayload(Map<String, String> payload) {
        if (payload == null || payload.isEmpty()) return "";
        try {
            return JSON.writeValueAsString(new TreeMap<>(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload not serializable", e);
        }
    }

    public String computeHash() {
        return Hashes.sha256Hex(toUnsignedBytes());
    }

    public byte[] toUnsignedBytes() {
        byte[] payloadBytes = canonicalPayload(payload).getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(estimateSize(payloadBytes.length, false));
        putStr(buf, id);
        putStr(buf, fromAddress);
        putStr(buf, toAddress);
        buf.putLong(amount);
        putStr(buf, type.wireName());
        putBytes(buf, payloadBytes);
        buf.putLong(timestamp);
        buf.putLong(fee);
        buf.putLong(nonce);
        return sliceToArray(buf);
    }

    /** Unsigned bytes followed by hash, signature and public key. */
    public byte[] serialize() {
        byte[] unsigned = toUnsignedBytes();
        byte[] hashBytes = hash == null ? new byte[0] : hash.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(unsigned.length + 12 + hashBytes.length + signature.length + publicKey.length);
        putBytes(buf, unsigned);
        putBytes(buf, hashBytes);
        putBytes(buf, signature);
        putBytes(buf, publicKey);
        return sliceToArray(buf);
    }

    public int serializedSize() {
        return serialize().length;
    }

    /**
     * Stamp the sender's account nonce. Admission rejects a nonce at or below the one the
     * ledger has already seen, so a confirmed transaction cannot be replayed under a new id.
     *
     * @throws IllegalStateException once the hash is fixed
     */
    public void setNonce(long nonce) {
        if (hash != null) throw new IllegalStateException("Transaction " + id + " is already hashed");
        if (nonce < 0) throw new IllegalArgumentException("nonce must be >= 0");
        this.nonce = nonce;
    }

    /**
     * Signs with {@code signer}, whose address must equal the declared sender.
     *
     * @throws ChainException ADDRESS_MISMATCH when the key belongs to another address,
     *                        INVALID_TRANSACTION for protocol-minted transactions
     */
    public void sign(Signer signer) {
        if (isProtocolMinted()) {
            throw new ChainException(ChainError.INVALID_TRANSACTION, "Protocol-minted transactions are not signed");
        }
        if (signer == null || !fromAddress.equals(signer.address())) {
            throw new ChainException(ChainError.ADDRESS_MISMATCH,
                    "Signer " + (signer == null ? null : signer.address()) + " does not match sender " + fromAddress);
        }
        String h = computeHash();
        byte[] sig = signer.sign(h.getBytes(StandardCharsets.UTF_8));
        this.hash = h;
        this.signature = sig.clone();
        this.publicKey = signer.publicKey();
    }

    public boolean isValid() {
        return isValid(SignatureUtil.verifier());
    }

    /** Structural, hash and signature checks. Never throws. */
    public boolean isValid(SignatureVerifier verifier) {
        if (amount < 0) return false;
        if (isProtocolMinted()) {
            return type == TransactionType.MINING_REWARD && amount > 0 && toAddress != null
                    && computeHash().equals(hash);
        }
        if (type == TransactionType.MINING_REWARD) {
            LOG.fine(() -> "Reward transaction with a sender: " + id);
            return false;
        }
        if (type.requiresRecipient() && toAddress == null) {
            LOG.fine(() -> "Missing recipient: " + id);
            return false;
        }
        if (amount == 0 && !type.zeroAmountAllowed()) {
            LOG.fine(() -> "Zero amount: " + id);
            return false;
        }
        if (signature.length == 0 || publicKey.length == 0) {
            LOG.fine(() -> "Missing signature: " + id);
            return false;
        }
        if (!computeHash().equals(hash)) {
            LOG.fine(() -> "Hash mismatch: " + id);
            return false;
        }
        try {
            if (!fromAddress.equals(verifier.deriveAddress(publicKey))) {
                LOG.fine(() -> "Public key does not belong to sender: " + id);
                return false;
            }
            return verifier.verify(hash.getBytes(StandardCharsets.UTF_8), signature, publicKey);
        } catch (ChainException e) {
            LOG.fine(() -> "Key material rejected for " + id + ": " + e.getMessage());
            return false;
        }
    }

    public boolean isExpired(long now, long maxAgeMillis) {
        return now - timestamp > maxAgeMillis;
    }

    // -------------------- helpers --------------------
    private static String newId() {
        return "tx_" + UUID.randomUUID().toString().replace("-", "");
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    private int estimateSize(int payloadLen, boolean includeSig) {
        int size = 0;
        size += 4 + utf8Len(id);
        size += 4 + utf8Len(fromAddress);
        size += 4 + utf8Len(toAddress);
        size += 4 + utf8Len(type.wireName());
        size += 4 + payloadLen;
        size += 8 * 4;
        if (includeSig) size += 4 + signature.length + 4 + publicKey.length;
        return size;
    }

    private static int utf8Len(String s) {
        return s == null ? 0 : s.getBytes(StandardCharsets.UTF_8).length;
    }

    private static void putStr(ByteBuffer buf, String s){
        byte[] b = s == null ? new byte[0] : s.getBytes(StandardCharsets.UTF_8);
        putBytes(buf, b);
    }
    private static void putBytes(ByteBuffer buf, byte[] b){
        buf.putInt(b.length); buf.put(b);
    }
    private static byte[] sliceToArray(ByteBuffer buf){
        buf.flip(); byte[] out = new byte[buf.remaining()]; buf.get(out); return out;
    }

    @Override public String toString() {
        return "Transaction{" + type + " " + fromAddress + "->" + toAddress + " amount=" + amount + " fee=" + fee + "}";
    }
}
