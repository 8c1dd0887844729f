package com.seamcarving.server.carve;

/**
 * Importance of a single pixel. Higher energy means the pixel is less likely to
 * be part of a removed seam.
 */
@FunctionalInterface
public interface EnergyFunction {
    long energyAt(Pos pos);
}
