package de.bsommerfeld.botradar.core.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * A maximal group of accounts connected directly or transitively. Only the
 * membership is meaningful; members are kept sorted so two clusters with the
 * same accounts are equal.
 *
 * @param members sorted, distinct account ids
 */
public record AccountCluster(List<String> members) {

    public AccountCluster {
        List<String> sorted = new ArrayList<>(members);
        Collections.sort(sorted);
        members = Collections.unmodifiableList(sorted);
    }

    public static AccountCluster of(Collection<String> members) {
        return new AccountCluster(new ArrayList<>(members));
    }

    public int size() {
        return members.size();
    }

    public boolean contains(String accountId) {
        return Collections.binarySearch(members, accountId) >= 0;
    }
}
