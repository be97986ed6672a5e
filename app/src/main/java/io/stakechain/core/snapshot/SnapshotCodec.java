package io.stakechain.core.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stakechain.core.node.ChainStats;
import io.stakechain.core.protocol.Block;
import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;
import io.stakechain.core.protocol.Hashes;
import io.stakechain.core.protocol.Transaction;
import io.stakechain.core.protocol.TransactionType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON form of a {@link ChainSnapshot}:
 * {@code {chain:[...], balances:{...}, nonces:{...}, stats:{...}, difficulty:n, pendingTransactions:[...]}}.
 * Byte fields (signatures, public keys) are hex.
 */
public final class SnapshotCodec {
    private static final ObjectMapper JSON = new ObjectMapper();

    private SnapshotCodec(){}

    public static String toJson(ChainSnapshot snapshot) {
        ObjectNode root = JSON.createObjectNode();
        ArrayNode chain = root.putArray("chain");
        for (Block b : snapshot.chain()) chain.add(blockNode(b));
        root.set("balances", longMap(snapshot.balances()));
        root.set("nonces", longMap(snapshot.nonces()));
        root.set("stats", statsNode(snapshot.stats()));
        root.put("difficulty", snapshot.difficulty());
        ArrayNode pending = root.putArray("pendingTransactions");
        for (Transaction tx : snapshot.pendingTransactions()) pending.add(txNode(tx));
        try {
            return JSON.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Snapshot not serializable", e);
        }
    }

    /** @throws ChainException INVALID_SNAPSHOT for malformed input */
    public static ChainSnapshot fromJson(String json) {
        try {
            JsonNode root = JSON.readTree(json);
            if (root == null || !root.isObject()) throw new IOException("Snapshot must be a JSON object");
            List<Block> chain = new ArrayList<>();
            for (JsonNode n : root.path("chain")) chain.add(readBlock(n));
            List<Transaction> pending = new ArrayList<>();
            for (JsonNode n : root.path("pendingTransactions")) pending.add(readTx(n));
            return new ChainSnapshot(chain, readLongMap(root.path("balances")), readLongMap(root.path("nonces")),
                    readStats(root.path("stats")), root.path("difficulty").asInt(), pending);
        } catch (ChainException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ChainException(ChainError.INVALID_SNAPSHOT, "Malformed snapshot: " + e.getMessage(), e);
        }
    }

    public static void write(ChainSnapshot snapshot, Path path) throws IOException {
        Files.writeString(path, toJson(snapshot));
    }

    public static ChainSnapshot read(Path path) throws IOException {
        return fromJson(Files.readString(path));
    }

    // ---------- writers ----------

    private static ObjectNode blockNode(Block b) {
        ObjectNode n = JSON.createObjectNode();
        n.put("id", b.id());
        n.put("height", b.height());
        n.put("timestamp", b.timestamp());
        n.put("previousHash", b.previousHash());
        n.put("hash", b.hash());
        n.put("nonce", b.nonce());
        n.put("difficulty", b.difficulty());
        n.put("validator", b.validator());
        n.put("merkleRoot", b.merkleRoot());
        n.put("gasUsed", b.gasUsed());
        n.put("gasLimit", b.gasLimit());
        n.put("maxTransactions", b.maxTransactions());
        n.put("signature", Hashes.toHex(b.signature()));
        n.put("signerPublicKey", Hashes.toHex(b.signerPublicKey()));
        ArrayNode txs = n.putArray("transactions");
        for (Transaction tx : b.transactions()) txs.add(txNode(tx));
        return n;
    }

    private static ObjectNode txNode(Transaction tx) {
        ObjectNode n = JSON.createObjectNode();
        n.put("id", tx.id());
        n.put("fromAddress", tx.fromAddress());
        n.put("toAddress", tx.toAddress());
        n.put("amount", tx.amount());
        n.put("type", tx.type().wireName());
        ObjectNode payload = n.putObject("payload");
        tx.payload().forEach(payload::put);
        n.put("fee", tx.fee());
        n.put("timestamp", tx.timestamp());
        n.put("nonce", tx.nonce());
        n.put("hash", tx.hash());
        n.put("signature", Hashes.toHex(tx.signature()));
        n.put("publicKey", Hashes.toHex(tx.publicKey()));
        return n;
    }

    private static ObjectNode statsNode(ChainStats s) {
        ObjectNode n = JSON.createObjectNode();
        if (s == null) return n;
        n.put("totalSupply", s.totalSupply());
        n.put("totalTransactions", s.totalTransactions());
        n.put("totalBlocks", s.totalBlocks());
        n.put("averageBlockTime", s.averageBlockTimeMs());
        n.put("hashRate", s.hashRate());
        n.put("chainLength", s.chainLength());
        n.put("pendingTransactions", s.pendingTransactions());
        n.put("difficulty", s.difficulty());
        return n;
    }

    private static ObjectNode longMap(Map<String, Long> m) {
        ObjectNode n = JSON.createObjectNode();
        new TreeMap<>(m).forEach(n::put);
        return n;
    }

    // ---------- readers ----------

    private static Block readBlock(JsonNode n) {
        List<Transaction> txs = new ArrayList<>();
        for (JsonNode t : n.path("transactions")) txs.add(readTx(t));
        return Block.builder()
                .id(text(n, "id"))
                .height(n.path("height").asLong())
                .timestamp(n.path("timestamp").asLong())
                .previousHash(text(n, "previousHash"))
                .hash(text(n, "hash"))
                .nonce(n.path("nonce").asLong())
                .difficulty(n.path("difficulty").asInt())
                .validator(text(n, "validator"))
                .merkleRoot(text(n, "merkleRoot"))
                .gasUsed(n.path("gasUsed").asLong())
                .gasLimit(n.path("gasLimit").asLong(Block.DEFAULT_GAS_LIMIT))
                .maxTransactions(n.path("maxTransactions").asInt(1000))
                .signature(Hashes.fromHex(text(n, "signature")))
                .signerPublicKey(Hashes.fromHex(text(n, "signerPublicKey")))
                .transactions(txs)
                .build();
    }

    private static Transaction readTx(JsonNode n) {
        Map<String, String> payload = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = n.path("payload").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            payload.put(e.getKey(), e.getValue().asText());
        }
        return Transaction.builder()
                .id(text(n, "id"))
                .from(text(n, "fromAddress"))
                .to(text(n, "toAddress"))
                .amount(n.path("amount").asLong())
                .type(TransactionType.fromWireName(text(n, "type")))
                .payload(payload)
                .fee(n.path("fee").asLong())
                .timestamp(n.path("timestamp").asLong())
                .nonce(n.path("nonce").asLong())
                .hash(text(n, "hash"))
                .signature(Hashes.fromHex(text(n, "signature")))
                .publicKey(Hashes.fromHex(text(n, "publicKey")))
                .build();
    }

    private static ChainStats readStats(JsonNode n) {
        return new ChainStats(
                n.path("totalSupply").asLong(),
                n.path("totalTransactions").asLong(),
                n.path("totalBlocks").asLong(),
                n.path("averageBlockTime").asLong(),
                n.path("hashRate").asDouble(),
                n.path("chainLength").asLong(),
                n.path("pendingTransactions").asInt(),
                n.path("difficulty").asInt(),
                false,
                null);
    }

    private static Map<String, Long> readLongMap(JsonNode n) {
        Map<String, Long> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = n.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            out.put(e.getKey(), e.getValue().asLong());
        }
        return out;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }
}
