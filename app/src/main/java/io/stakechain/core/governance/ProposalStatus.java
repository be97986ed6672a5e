package io.stakechain.core.governance;

import java.util.Locale;

public enum ProposalStatus {
    DEPOSIT_PERIOD, VOTING_PERIOD, PASSED, REJECTED, FAILED;

    public boolean isTerminal() {
        return this == PASSED || this == REJECTED || this == FAILED;
    }

    public String wireName() { return name().toLowerCase(Locale.ROOT); }

    public static ProposalStatus fromWireName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
