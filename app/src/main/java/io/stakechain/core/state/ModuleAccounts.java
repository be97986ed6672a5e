package io.stakechain.core.state;

import java.util.Set;

/**
 * Ledger accounts owned by the protocol rather than a key holder.
 * Funds parked here still count toward total supply.
 */
public final class ModuleAccounts {
    /** Collects transaction fees; funds spend_pool proposals. */
    public static final String COMMUNITY_POOL = "module:community_pool";
    /** Holds self-bonded and delegated stake, including unbonding amounts. */
    public static final String BONDED_POOL = "module:bonded_pool";
    /** Escrows governance deposits until refund or burn. */
    public static final String GOV_ESCROW = "module:gov_escrow";

    public static final Set<String> ALL = Set.of(COMMUNITY_POOL, BONDED_POOL, GOV_ESCROW);

    private ModuleAccounts(){}

    public static boolean isModuleAccount(String address) {
        return address != null && ALL.contains(address);
    }
}
