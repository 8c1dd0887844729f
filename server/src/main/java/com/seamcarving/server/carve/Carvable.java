package com.seamcarving.server.carve;

import java.util.List;

/**
 * Removes vertical seams from an image one at a time. The underlying image is
 * left untouched.
 */
public class Carvable {

    private final CarvedGrid carved;
    private final SeamFinder seamFinder;
    private final EnergyFunction energy;

    public Carvable(PixelGrid source) {
        this.carved = new CarvedGrid(source);
        this.seamFinder = new SeamFinder(source.getWidth(), source.getHeight());
        // Evaluated on the carved view so removed seams are taken into account
        this.energy = GradientEnergy.of(carved);
    }

    /**
     * Removes the lowest-energy vertical seam, reducing the width by one.
     *
     * @return the removed seam, bottom row first, in the coordinates of the
     *         image before the removal
     */
    public List<Pos> removeSeam() {
        if (carved.getWidth() == 0) {
            throw new IllegalStateException("Image has no column left to remove");
        }
        List<Pos> seam = seamFinder.extractSeam(energy);
        carved.removeSeam(seam);
        return seam;
    }

    public CarvedGrid getResult() {
        return carved;
    }
}
