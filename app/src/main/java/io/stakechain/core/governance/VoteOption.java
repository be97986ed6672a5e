package io.stakechain.core.governance;

import io.stakechain.core.protocol.ChainError;
import io.stakechain.core.protocol.ChainException;

import java.util.Locale;

public enum VoteOption {
    YES, NO, NO_WITH_VETO, ABSTAIN;

    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    /** @throws ChainException INVALID_OPTION for anything but yes, no, no_with_veto and abstain */
    public static VoteOption fromWireName(String name) {
        if (name != null) {
            for (VoteOption o : values()) {
                if (o.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) return o;
            }
        }
        throw new ChainException(ChainError.INVALID_OPTION, "Invalid vote option: " + name);
    }
}
