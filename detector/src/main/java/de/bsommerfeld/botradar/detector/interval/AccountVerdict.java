package de.bsommerfeld.botradar.detector.interval;

import java.util.Set;

/**
 * A flagged account together with the statistics and rules that flagged it.
 *
 * @param accountId the account
 * @param stats     gap statistics the decision was based on
 * @param reasons   non-empty set of rules that fired
 */
public record AccountVerdict(String accountId, IntervalStats stats, Set<FlagReason> reasons) {

    public AccountVerdict {
        reasons = Set.copyOf(reasons);
    }

    public boolean flaggedBy(FlagReason reason) {
        return reasons.contains(reason);
    }
}
