package com.seamcarving.server.carve;

/**
 * Dual-gradient energy: squared channel differences between the top and bottom
 * neighbours plus those between the left and right neighbours. At the border
 * the missing neighbour is replaced by the pixel itself.
 */
public final class GradientEnergy {

    private GradientEnergy() {
    }

    public static long energy(PixelGrid grid, Pos pos) {
        Pos[] around = pos.surrounding();
        Pos size = grid.size();
        Pos top = around[0];
        Pos bottom = around[1].before(size) ? around[1] : pos;
        Pos left = around[2];
        Pos right = around[3].before(size) ? around[3] : pos;
        return squaredDifference(grid, top, bottom) + squaredDifference(grid, left, right);
    }

    /**
     * Energy bound to one grid, for use by {@link SeamFinder}.
     */
    public static EnergyFunction of(PixelGrid grid) {
        return pos -> energy(grid, pos);
    }

    private static long squaredDifference(PixelGrid grid, Pos a, Pos b) {
        long sum = 0;
        for (int c = 0; c < grid.getChannelCount(); c++) {
            long diff = (long) grid.getSample(a.x, a.y, c) - grid.getSample(b.x, b.y, c);
            sum += diff * diff;
        }
        return sum;
    }
}
