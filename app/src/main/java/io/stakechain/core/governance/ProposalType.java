package io.stakechain.core.governance;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.util.Locale;

public enum ProposalType {
    TEXT, PARAMETER_CHANGE, SOFTWARE_UPGRADE, SPEND_POOL;

    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    /** @throws ChainException INVALID_PROPOSAL for an unknown name */
    public static ProposalType fromWireName(String name) {
        if (name != null) {
            for (ProposalType t : values()) {
                if (t.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return t;
            }
        }
        throw new ChainException(ChainError.INVALID_PROPOSAL, "Unknown proposal type: " + name);
    }
}
