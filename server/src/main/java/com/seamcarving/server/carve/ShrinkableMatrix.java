package com.seamcarving.server.carve;

import java.util.List;

/**
 * Dense row-major storage whose logical width can shrink one seam at a time.
 * Cells are stored at {@code x + y * originalWidth}; columns at or beyond
 * {@link #getCurrentWidth()} are removed and must not be read.
 */
public abstract class ShrinkableMatrix {

    protected final int originalWidth;
    protected final int height;
    protected int currentWidth;

    protected ShrinkableMatrix(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Matrix dimensions must be non-negative: " + width + "x" + height);
        }
        this.originalWidth = width;
        this.height = height;
        this.currentWidth = width;
    }

    public int getCurrentWidth() {
        return currentWidth;
    }

    protected final int index(int x, int y) {
        return x + y * originalWidth;
    }

    /**
     * Removes one cell per row. Each row's tail starting at the seam column is
     * rotated left by one, so the removed cell lands past the new logical width.
     */
    public void removeSeam(List<Pos> seam) {
        if (currentWidth == 0) {
            throw new IllegalStateException("Cannot remove a seam from an empty matrix");
        }
        for (Pos p : seam) {
            int rowStart = p.y * originalWidth;
            rotateLeft(rowStart + p.x, rowStart + currentWidth);
        }
        currentWidth--;
    }

    /**
     * Moves every cell in [from, to) one slot to the left and the cell at
     * {@code from} to {@code to - 1}.
     */
    protected abstract void rotateLeft(int from, int to);
}
