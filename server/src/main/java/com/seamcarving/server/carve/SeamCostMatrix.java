package com.seamcarving.server.carve;

import java.util.Arrays;

/**
 * Per-cell minimum path cost from row 0 plus the column offset of the
 * predecessor the path came through. A cell is either absent or fully valid.
 */
class SeamCostMatrix extends ShrinkableMatrix {

    static final long ABSENT = -1L;
    static final byte NO_PREDECESSOR = Byte.MIN_VALUE;

    private final long[] costs;
    private final byte[] predecessorDx;

    SeamCostMatrix(int width, int height) {
        super(width, height);
        this.costs = new long[width * height];
        this.predecessorDx = new byte[width * height];
        Arrays.fill(costs, ABSENT);
        Arrays.fill(predecessorDx, NO_PREDECESSOR);
    }

    boolean isPresent(int x, int y) {
        return costs[index(x, y)] != ABSENT;
    }

    long getCost(int x, int y) {
        return costs[index(x, y)];
    }

    byte getPredecessorDx(int x, int y) {
        return predecessorDx[index(x, y)];
    }

    void set(int x, int y, long cost, byte dx) {
        int i = index(x, y);
        costs[i] = cost;
        predecessorDx[i] = dx;
    }

    void clear(int x, int y) {
        int i = index(x, y);
        costs[i] = ABSENT;
        predecessorDx[i] = NO_PREDECESSOR;
    }

    @Override
    protected void rotateLeft(int from, int to) {
        if (to - from < 2) {
            return;
        }
        long firstCost = costs[from];
        byte firstDx = predecessorDx[from];
        System.arraycopy(costs, from + 1, costs, from, to - from - 1);
        System.arraycopy(predecessorDx, from + 1, predecessorDx, from, to - from - 1);
        costs[to - 1] = firstCost;
        predecessorDx[to - 1] = firstDx;
    }
}
