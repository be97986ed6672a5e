package io.stakechain.core.protocol;

import java.util.ArrayList;
import java.util.List;

/**
 * Merkle root over hex-encoded transaction hashes.
 * - No leaves: root = sha256("empty").
 * - Odd count at a level: the last hash is paired with itself.
 * - Parent = sha256(leftHex + rightHex).
 */
public final class Merkle {
    public static final String EMPTY_ROOT = Hashes.sha256Hex("empty");

    private Merkle(){}

    public static String rootOf(List<String> leaves) {
        if (leaves == null || leaves.isEmpty()) return EMPTY_ROOT;
        List<String> level = new ArrayList<>(leaves);
        while (level.size() > 1) {
            List<String> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = (i + 1 < level.size()) ? level.get(i + 1) : left;
                next.add(Hashes.sha256Hex(left + right));
            }
            level = next;
        }
        return level.get(0);
    }
}
