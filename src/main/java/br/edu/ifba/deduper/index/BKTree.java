package br.edu.ifba.deduper.index;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Burkhard-Keller tree over 64-bit codes, stored as an arena of parallel arrays.
 *
 * <p>Each node holds one reference code and the ids of every file with that
 * exact code. A child edge is labelled with the Hamming distance between the
 * parent's code and the child's code. For a query at distance {@code d} from a
 * node, only children whose label {@code e} satisfies {@code |e - d| <= r} can
 * contain matches (triangle inequality), so pruning never drops a result.</p>
 *
 * <p>Insertion and query are iterative; degenerate inputs cannot overflow the stack.</p>
 */
public final class BKTree implements NeighborIndex {

    private static final int NONE = -1;

    private long[] codes;
    private int[] edgeDistance;
    private int[] firstChild;
    private int[] nextSibling;
    private final List<List<String>> fileIds;
    private int nodeCount;
    private int size;
    private volatile boolean frozen;

    public BKTree() {
        this(16);
    }

    public BKTree(int expectedSize) {
        int capacity = Math.max(16, expectedSize);
        this.codes = new long[capacity];
        this.edgeDistance = new int[capacity];
        this.firstChild = new int[capacity];
        this.nextSibling = new int[capacity];
        this.fileIds = new ArrayList<>(capacity);
    }

    @Override
    public void insert(long code, @NotNull String fileId) {
        if (frozen) {
            throw new IllegalStateException("cannot insert into a frozen index");
        }
        if (fileId == null) {
            throw new IllegalArgumentException("fileId cannot be null");
        }
        size++;
        if (nodeCount == 0) {
            newNode(code, fileId, 0);
            return;
        }

        int node = 0;
        while (true) {
            int distance = HammingDistance.between(code, codes[node]);
            if (distance == 0) {
                fileIds.get(node).add(fileId);
                return;
            }
            int child = childWithEdge(node, distance);
            if (child == NONE) {
                int created = newNode(code, fileId, distance);
                nextSibling[created] = firstChild[node];
                firstChild[node] = created;
                return;
            }
            node = child;
        }
    }

    @Override
    public List<NeighborMatch> query(long code, int radius, @NotNull ComparisonCounter counter) {
        if (radius < 0) {
            throw new IllegalArgumentException("radius cannot be negative");
        }
        List<NeighborMatch> matches = new ArrayList<>();
        if (nodeCount == 0) {
            return matches;
        }

        int[] stack = new int[Math.min(nodeCount, 64)];
        int top = 0;
        stack[top++] = 0;
        while (top > 0) {
            int node = stack[--top];
            int distance = HammingDistance.between(code, codes[node]);
            counter.increment();
            if (distance <= radius) {
                for (String id : fileIds.get(node)) {
                    matches.add(new NeighborMatch(id, distance));
                }
            }
            for (int child = firstChild[node]; child != NONE; child = nextSibling[child]) {
                if (Math.abs(edgeDistance[child] - distance) <= radius) {
                    if (top == stack.length) {
                        stack = Arrays.copyOf(stack, stack.length * 2);
                    }
                    stack[top++] = child;
                }
            }
        }
        return matches;
    }

    @Override
    public void freeze() {
        frozen = true;
    }

    @Override
    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Number of distinct codes stored.
     */
    public int nodeCount() {
        return nodeCount;
    }

    private int childWithEdge(int node, int distance) {
        for (int child = firstChild[node]; child != NONE; child = nextSibling[child]) {
            if (edgeDistance[child] == distance) {
                return child;
            }
        }
        return NONE;
    }

    private int newNode(long code, String fileId, int distance) {
        if (nodeCount == codes.length) {
            int capacity = codes.length * 2;
            codes = Arrays.copyOf(codes, capacity);
            edgeDistance = Arrays.copyOf(edgeDistance, capacity);
            firstChild = Arrays.copyOf(firstChild, capacity);
            nextSibling = Arrays.copyOf(nextSibling, capacity);
        }
        int node = nodeCount++;
        codes[node] = code;
        edgeDistance[node] = distance;
        firstChild[node] = NONE;
        nextSibling[node] = NONE;
        List<String> ids = new ArrayList<>(1);
        ids.add(fileId);
        fileIds.add(ids);
        return node;
    }
}
