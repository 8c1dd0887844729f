package com.seamcarving.server.carve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Finds minimum-energy vertical seams and keeps the path costs of the previous
 * extraction cached between calls.
 *
 * After a seam is removed only three kinds of cells are recomputed:
 * <ul>
 * <li>the cells whose chosen path went through a removed or invalidated cell,</li>
 * <li>the cells next to the removed seam, whose neighbours and therefore energy
 * and candidate predecessors changed,</li>
 * <li>cells for which a recomputed predecessor now offers a cheaper path.</li>
 * </ul>
 * Every extracted seam is identical to the one a full recomputation on the
 * current grid would produce. Ties are broken towards the lowest column.
 */
public class SeamFinder {

    private static final Logger logger = LoggerFactory.getLogger(SeamFinder.class);

    private final SeamCostMatrix contents;
    private final DirtyBounds dirty;
    private final int height;
    private int width;

    public SeamFinder(int width, int height) {
        this.width = width;
        this.height = height;
        this.contents = new SeamCostMatrix(width, height);
        this.dirty = new DirtyBounds(width);
    }

    public int getWidth() {
        return width;
    }

    /**
     * Extracts the cheapest seam, removes it from the cache and returns it as
     * one position per row, from the bottom row to the top row.
     *
     * @param energy energy of the grid with all previously extracted seams removed
     */
    public List<Pos> extractSeam(EnergyFunction energy) {
        if (width == 0) {
            throw new IllegalStateException("No column left to extract a seam from");
        }
        List<Pos> seam = new ArrayList<>(height);
        if (height == 0) {
            width--;
            contents.removeSeam(seam);
            return seam;
        }

        fill(energy);

        // 1. Cheapest bottom cell, lowest x on ties
        int bottom = height - 1;
        int x = 0;
        for (int candidate = 1; candidate < width; candidate++) {
            if (contents.getCost(candidate, bottom) < contents.getCost(x, bottom)) {
                x = candidate;
            }
        }
        long seamCost = contents.getCost(x, bottom);

        // 2. Walk the predecessors up to row 0, clearing as we go
        for (int y = bottom; y >= 0; y--) {
            Pos p = new Pos(x, y);
            seam.add(p);
            if (y > 0) {
                byte dx = contents.getPredecessorDx(x, y);
                if (dx == SeamCostMatrix.NO_PREDECESSOR) {
                    throw new IllegalStateException("Seam cell " + p + " has no predecessor");
                }
                x += dx;
            }
            clear(p);
        }
        checkSeam(seam);

        // 3. Compact, then invalidate the cells whose surroundings changed
        width--;
        contents.removeSeam(seam);
        dirty.shiftForRemovedSeam(width);
        invalidateAround(seam);

        logger.debug("Extracted seam with cost {} ending at x={}, {} columns left", seamCost,
                seam.get(0).x, width);
        return seam;
    }

    /**
     * Computes every absent cell in the dirty columns, top to bottom.
     *
     * @return the number of cells computed
     */
    int fill(EnergyFunction energy) {
        int computed = 0;
        for (int y = 0; y < height; y++) {
            // hi may grow while the row is scanned, cleared cells are always on later rows
            for (int x = dirty.getLo(); x < dirty.getHi(); x++) {
                if (contents.isPresent(x, y)) {
                    continue;
                }
                Pos p = new Pos(x, y);
                computeCell(p, energy.energyAt(p));
                offerToSuccessors(p);
                computed++;
            }
        }
        dirty.reset(width);
        if (logger.isTraceEnabled()) {
            logger.trace("Filled {} cells of a {}x{} cost matrix", computed, width, height);
        }
        return computed;
    }

    boolean isPresent(Pos p) {
        return contents.isPresent(p.x, p.y);
    }

    long getCost(Pos p) {
        return contents.getCost(p.x, p.y);
    }

    private void computeCell(Pos p, long localEnergy) {
        long best = SeamCostMatrix.ABSENT;
        int bestX = -1;
        for (Pos pred : p.predecessors(width)) {
            long cost = contents.getCost(pred.x, pred.y);
            if (cost == SeamCostMatrix.ABSENT) {
                continue;
            }
            if (best == SeamCostMatrix.ABSENT || cost < best) {
                best = cost;
                bestX = pred.x;
            }
        }
        if (best == SeamCostMatrix.ABSENT) {
            contents.set(p.x, p.y, localEnergy, SeamCostMatrix.NO_PREDECESSOR);
        } else {
            contents.set(p.x, p.y, best + localEnergy, (byte) (bestX - p.x));
        }
    }

    // A freshly computed cell may now be a better predecessor for a cached successor
    private void offerToSuccessors(Pos p) {
        long offered = contents.getCost(p.x, p.y);
        for (Pos s : p.successors(width, height)) {
            if (!contents.isPresent(s.x, s.y)) {
                continue;
            }
            int currentX = s.x + contents.getPredecessorDx(s.x, s.y);
            long current = contents.getCost(currentX, p.y);
            if (current == SeamCostMatrix.ABSENT) {
                throw new IllegalStateException("Cached cell " + s + " points to an absent predecessor");
            }
            if (offered < current || (offered == current && p.x < currentX)) {
                clear(s);
            }
        }
    }

    /**
     * Marks {@code p} absent along with every cell whose cached path runs
     * through it.
     */
    void clear(Pos p) {
        Deque<Pos> worklist = new ArrayDeque<>();
        worklist.push(p);
        while (!worklist.isEmpty()) {
            Pos current = worklist.pop();
            contents.clear(current.x, current.y);
            dirty.widen(current.x);
            for (Pos s : current.successors(width, height)) {
                if (contents.isPresent(s.x, s.y)
                        && s.x + contents.getPredecessorDx(s.x, s.y) == current.x) {
                    worklist.push(s);
                }
            }
        }
    }

    // Cells within one column of the seam in the row itself or the rows
    // next to it see different neighbours or predecessors after compaction.
    private void invalidateAround(List<Pos> seam) {
        int[] seamX = new int[height];
        for (Pos p : seam) {
            seamX[p.y] = p.x;
        }
        for (int y = 0; y < height; y++) {
            int lo = seamX[y];
            int hi = seamX[y];
            if (y > 0) {
                lo = Math.min(lo, seamX[y - 1]);
                hi = Math.max(hi, seamX[y - 1]);
            }
            if (y + 1 < height) {
                lo = Math.min(lo, seamX[y + 1]);
                hi = Math.max(hi, seamX[y + 1]);
            }
            for (int x = Math.max(0, lo - 1); x <= hi && x < width; x++) {
                clear(new Pos(x, y));
            }
        }
    }

    private void checkSeam(List<Pos> seam) {
        if (seam.size() != height) {
            throw new IllegalStateException("Seam has " + seam.size() + " positions for " + height + " rows");
        }
        for (int i = 0; i < seam.size(); i++) {
            Pos p = seam.get(i);
            if (p.y != height - 1 - i || p.x >= width) {
                throw new IllegalStateException("Seam position " + p + " is out of place at index " + i);
            }
            if (i > 0 && Math.abs(p.x - seam.get(i - 1).x) > 1) {
                throw new IllegalStateException("Seam is not connected between " + seam.get(i - 1) + " and " + p);
            }
        }
    }
}
