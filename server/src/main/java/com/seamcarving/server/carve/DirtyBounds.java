package com.seamcarving.server.carve;

/**
 * Column range [lo, hi) that may contain absent cost cells.
 */
class DirtyBounds {
    private int lo;
    private int hi;

    DirtyBounds(int width) {
        this.lo = 0;
        this.hi = width;
    }

    int getLo() {
        return lo;
    }

    int getHi() {
        return hi;
    }

    boolean isEmpty() {
        return lo >= hi;
    }

    void widen(int x) {
        lo = Math.min(lo, x);
        hi = Math.max(hi, x + 1);
    }

    void reset(int width) {
        lo = width;
        hi = 0;
    }

    /**
     * Cells right of a removed seam moved one column left.
     */
    void shiftForRemovedSeam(int newWidth) {
        if (isEmpty()) {
            reset(newWidth);
            return;
        }
        lo = Math.max(0, lo - 1);
        hi = Math.min(hi, newWidth);
    }
}
