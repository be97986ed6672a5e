package io.stakechain.core.governance;

import java.util.Collection;

/** Weighted vote sums per option. */
public record TallyResult(long yes, long no, long noWithVeto, long abstain) {
    public static final TallyResult EMPTY = new TallyResult(0, 0, 0, 0);

    public static TallyResult of(Collection<Vote> votes) {
        long yes = 0, no = 0, veto = 0, abstain = 0;
        for (Vote v : votes) {
            if (v.option() == VoteOption.YES) yes += v.weight();
            else if (v.option() == VoteOption.NO) no += v.weight();
            else if (v.option() == VoteOption.NO_WITH_VETO) veto += v.weight();
            else abstain += v.weight();
        }
        return new TallyResult(yes, no, veto, abstain);
    }

    public long total() {
        return yes + no + noWithVeto + abstain;
    }
}
