package com.seamcarving.server.carve;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * An integer position in a pixel grid. Both coordinates are non-negative.
 */
public final class Pos {
    public final int x;
    public final int y;

    public Pos(int x, int y) {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Position coordinates must be non-negative: " + x + "," + y);
        }
        this.x = x;
        this.y = y;
    }

    /**
     * True when this position lies strictly inside the rectangle [0, max).
     */
    public boolean before(Pos max) {
        return x < max.x && y < max.y;
    }

    public Pos plus(Pos other) {
        return new Pos(x + other.x, y + other.y);
    }

    // Saturating: never goes below zero on either axis
    public Pos minus(Pos other) {
        return new Pos(Math.max(0, x - other.x), Math.max(0, y - other.y));
    }

    /**
     * The cells directly below-left, below and below-right, in ascending x order.
     * Empty on the last row.
     */
    public List<Pos> successors(int width, int height) {
        if (y + 1 >= height) {
            return List.of();
        }
        return rowNeighbours(y + 1, width);
    }

    /**
     * The cells directly above-left, above and above-right, in ascending x order.
     * Empty on row 0.
     */
    public List<Pos> predecessors(int width) {
        if (y == 0) {
            return List.of();
        }
        return rowNeighbours(y - 1, width);
    }

    private List<Pos> rowNeighbours(int row, int width) {
        List<Pos> result = new ArrayList<>(3);
        if (x > 0) {
            result.add(new Pos(x - 1, row));
        }
        if (x < width) {
            result.add(new Pos(x, row));
        }
        if (x + 1 < width) {
            result.add(new Pos(x + 1, row));
        }
        return result;
    }

    /**
     * Returns the top, bottom, left and right positions, in this order.
     * Top and left stay on this cell at the border; bottom and right are not
     * clamped, the caller checks them against the grid size.
     */
    public Pos[] surrounding() {
        return new Pos[] {
                new Pos(x, Math.max(0, y - 1)),
                new Pos(x, y + 1),
                new Pos(Math.max(0, x - 1), y),
                new Pos(x + 1, y)
        };
    }

    /**
     * Row-major iteration over [start, end). Each call to iterator() starts over.
     */
    public static Iterable<Pos> iterInRect(Pos start, Pos end) {
        return () -> new Iterator<Pos>() {
            private int nextX = start.x;
            private int nextY = start.before(end) ? start.y : end.y;

            @Override
            public boolean hasNext() {
                return nextY < end.y;
            }

            @Override
            public Pos next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                Pos current = new Pos(nextX, nextY);
                nextX++;
                if (nextX == end.x) {
                    nextX = start.x;
                    nextY++;
                }
                return current;
            }
        };
    }

    public static Iterable<Pos> iterInRect(Pos end) {
        return iterInRect(new Pos(0, 0), end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Pos))
            return false;
        Pos other = (Pos) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "Pos(" + x + ", " + y + ")";
    }
}
