package br.edu.ifba.deduper.cluster;

/**
 * Disjoint sets over {@code 0..n-1} with path compression and union by rank.
 *
 * Not thread-safe: unions happen in a single reducer.
 */
public final class UnionFind {

    private final int[] parent;
    private final byte[] rank;
    private int components;

    public UnionFind(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative");
        }
        this.parent = new int[size];
        this.rank = new byte[size];
        this.components = size;
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }
    }

    public int find(int element) {
        int root = element;
        while (parent[root] != root) {
            root = parent[root];
        }
        // Compress the path walked.
        while (parent[element] != root) {
            int next = parent[element];
            parent[element] = root;
            element = next;
        }
        return root;
    }

    /**
     * Merges the sets of the two elements.
     *
     * @return true if they were in different sets
     */
    public boolean union(int a, int b) {
        int rootA = find(a);
        int rootB = find(b);
        if (rootA == rootB) {
            return false;
        }
        if (rank[rootA] < rank[rootB]) {
            parent[rootA] = rootB;
        } else if (rank[rootA] > rank[rootB]) {
            parent[rootB] = rootA;
        } else {
            parent[rootB] = rootA;
            rank[rootA]++;
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
