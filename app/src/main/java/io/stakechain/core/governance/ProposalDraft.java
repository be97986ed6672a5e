package io.stakechain.core.governance;

import java.util.Map;

/**
 * Proposal submission data.
 *
 * Content keys by type:
 * - parameter_change: module, parameter, value
 * - software_upgrade: name, height (optional), info (optional)
 * - spend_pool: recipient, amount
 */
public record ProposalDraft(String title, String description, ProposalType type,
                            Map<String, String> content, long initialDeposit) {
    public ProposalDraft {
        content = content == null ? Map.of() : Map.copyOf(content);
    }
}
