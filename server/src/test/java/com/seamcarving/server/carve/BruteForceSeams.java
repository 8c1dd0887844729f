package com.seamcarving.server.carve;

import java.util.ArrayList;
import java.util.List;

/**
 * Reference seam search that recomputes every path cost from scratch.
 */
class BruteForceSeams {

    static List<Pos> find(PixelGrid grid) {
        int w = grid.getWidth();
        int h = grid.getHeight();
        long[][] cost = new long[h][w];
        int[][] from = new int[h][w];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                long e = GradientEnergy.energy(grid, new Pos(x, y));
                if (y == 0) {
                    cost[y][x] = e;
                    continue;
                }
                int bestX = -1;
                for (int px = x - 1; px <= x + 1; px++) {
                    if (px < 0 || px >= w)
                        continue;
                    if (bestX < 0 || cost[y - 1][px] < cost[y - 1][bestX]) {
                        bestX = px;
                    }
                }
                cost[y][x] = cost[y - 1][bestX] + e;
                from[y][x] = bestX;
            }
        }

        int x = 0;
        for (int c = 1; c < w; c++) {
            if (cost[h - 1][c] < cost[h - 1][x])
                x = c;
        }
        List<Pos> seam = new ArrayList<>();
        for (int y = h - 1; y >= 0; y--) {
            seam.add(new Pos(x, y));
            x = from[y][x];
        }
        return seam;
    }
}
