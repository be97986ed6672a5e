package io.stakechain.core.protocol;

import java.util.Locale;

/**
 * Transaction kinds with their fee multiplier and field rules.
 */
public enum TransactionType {
    TRANSFER("transfer", 1, true, false, true),
    DELEGATE("delegate", 2, true, false, true),
    UNDELEGATE("undelegate", 2, true, false, false),
    REDELEGATE("redelegate", 2, true, false, false),
    VOTE("vote", 1, false, true, false),
    CREATE_VALIDATOR("create_validator", 5, false, false, true),
    EDIT_VALIDATOR("edit_validator", 3, false, true, false),
    SUBMIT_PROPOSAL("submit_proposal", 10, false, true, true),
    DEPOSIT("deposit", 1, false, false, true),
    MINING_REWARD("mining_reward", 0, true, false, false);

    private final String wireName;
    private final int feeMultiplier;
    private final boolean requiresRecipient;
    private final boolean zeroAmountAllowed;
    private final boolean debitsAmount;

    TransactionType(String wireName, int feeMultiplier, boolean requiresRecipient,
                    boolean zeroAmountAllowed, boolean debitsAmount) {
        this.wireName = wireName;
        this.feeMultiplier = feeMultiplier;
        this.requiresRecipient = requiresRecipient;
        this.zeroAmountAllowed = zeroAmountAllowed;
        this.debitsAmount = debitsAmount;
    }

    public String wireName() { return wireName; }
    public int feeMultiplier() { return feeMultiplier; }
    public boolean requiresRecipient() { return requiresRecipient; }
    public boolean zeroAmountAllowed() { return zeroAmountAllowed; }

    /** True when applying the transaction moves {@code amount} out of the sender's liquid balance. */
    public boolean debitsAmount() { return debitsAmount; }

    public static TransactionType fromWireName(String name) {
        if (name == null) throw new IllegalArgumentException("Missing transaction type");
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (TransactionType t : values()) {
            if (t.wireName.equals(n)) return t;
        }
        throw new IllegalArgumentException("Unknown transaction type: " + name);
    }

    @Override public String toString() { return wireName; }
}
