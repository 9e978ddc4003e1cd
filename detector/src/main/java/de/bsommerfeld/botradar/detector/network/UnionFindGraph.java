package de.bsommerfeld.botradar.detector.network;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Disjoint-set forest with path halving and union by size. Components are
 * known after the last edge without any traversal, which keeps cluster
 * detection near-linear in nodes plus edges.
 */
public final class UnionFindGraph implements ConnectionGraph {

    private final Map<String, Integer> index = new HashMap<>();
    private final List<String> names = new ArrayList<>();
    private int[] parent = new int[16];
    private int[] size = new int[16];

    @Override
    public void addNode(String id) {
        indexOf(id);
    }

    @Override
    public void addEdge(String a, String b) {
        int ia = indexOf(a);
        if (a.equals(b))
            return;
        union(ia, indexOf(b));
    }

    @Override
    public int nodeCount() {
        return names.size();
    }

    @Override
    public List<Set<String>> connectedComponents() {
        Map<Integer, Set<String>> byRoot = new LinkedHashMap<>();
        for (int i = 0; i < names.size(); i++) {
            byRoot.computeIfAbsent(find(i), r -> new HashSet<>()).add(names.get(i));
        }
        return new ArrayList<>(byRoot.values());
    }

    private int indexOf(String id) {
        Integer existing = index.get(id);
        if (existing != null)
            return existing;

        int i = names.size();
        if (i == parent.length) {
            parent = Arrays.copyOf(parent, i * 2);
            size = Arrays.copyOf(size, i * 2);
        }
        parent[i] = i;
        size[i] = 1;
        names.add(id);
        index.put(id, i);
        return i;
    }

    private int find(int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private void union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb)
            return;
        if (size[ra] < size[rb]) {
            int t = ra;
            ra = rb;
            rb = t;
        }
        parent[rb] = ra;
        size[ra] += size[rb];
    }
}
