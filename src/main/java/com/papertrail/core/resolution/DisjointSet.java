package com.papertrail.core.resolution;

/**
 * Union-find over the dense index range {@code [0, size)} with path
 * compression and union by rank. Parent pointers live in a flat array,
 * so there are no object back-references.
 *
 * <p>The final partition depends only on the set of unions performed,
 * never on their order.</p>
 */
public final class DisjointSet {

    private final int[] parent;
    private final byte[] rank;
    private int components;

    public DisjointSet(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size must be >= 0");
        }
        this.parent = new int[size];
        this.rank = new byte[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
        this.components = size;
    }

    public int find(int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int next = parent[x];
            parent[x] = root;
            x = next;
        }
        return root;
    }

    /**
     * @return true if the two elements were in different sets
     */
    public boolean union(int a, int b) {
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return false;
        }
        if (rank[ra] < rank[rb]) {
            parent[ra] = rb;
        } else if (rank[ra] > rank[rb]) {
            parent[rb] = ra;
        } else {
            parent[rb] = ra;
            rank[ra]++;
        }
        components--;
        return true;
    }

    public boolean connected(int a, int b) {
        return find(a) == find(b);
    }

    public int size() {
        return parent.length;
    }

    public int components() {
        return components;
    }
}
