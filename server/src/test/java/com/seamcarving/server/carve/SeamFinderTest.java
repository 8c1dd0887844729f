package com.seamcarving.server.carve;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

public class SeamFinderTest {

    private static RasterImage randomImage(Random rnd, int w, int h, int channels, int maxValue) {
        int[] samples = new int[w * h * channels];
        for (int i = 0; i < samples.length; i++) {
            samples[i] = rnd.nextInt(maxValue + 1);
        }
        return new RasterImage(w, h, channels, samples);
    }

    @Test
    public void testExtractsCorrectSeam() {
        SeamFinder finder = new SeamFinder(3, 2);
        // energy matrix:
        // 0 1 2
        // 0 1 2
        List<Pos> seam = finder.extractSeam(p -> p.x);

        assertEquals(List.of(new Pos(0, 1), new Pos(0, 0)), seam);
        assertEquals(2, finder.getWidth());
    }

    @Test
    public void testFillComputesEveryCellOnce() {
        SeamFinder finder = new SeamFinder(10, 10);

        assertEquals(100, finder.fill(p -> 42));
        for (Pos p : Pos.iterInRect(new Pos(10, 10))) {
            assertTrue(finder.isPresent(p), "Cell " + p + " should be filled");
        }
        assertEquals(42 * 10, finder.getCost(new Pos(3, 9)));

        // Nothing is dirty any more
        assertEquals(0, finder.fill(p -> 42));
    }

    @Test
    public void testClearOnlyInvalidatesCellsThatDependOnIt() {
        SeamFinder finder = new SeamFinder(3, 3);
        // costs with energy = x:
        // 0 1 2
        // 0 1 3
        // 0 1 3
        finder.fill(p -> p.x);
        assertEquals(3, finder.getCost(new Pos(2, 1)));

        // Only (2,1) came through (1,0); (1,1) came through (0,0)
        finder.clear(new Pos(1, 0));

        for (Pos p : Pos.iterInRect(new Pos(3, 3))) {
            boolean expectedAbsent = p.equals(new Pos(1, 0)) || p.equals(new Pos(2, 1));
            assertEquals(!expectedAbsent, finder.isPresent(p), "Unexpected state for " + p);
        }

        // Refilling only needs the two cleared cells
        assertEquals(2, finder.fill(p -> p.x));
    }

    @Test
    public void testSeamsCoverEveryRow() {
        Random rnd = new Random(7);
        RasterImage img = randomImage(rnd, 9, 6, 3, 255);
        CarvedGrid carved = new CarvedGrid(img);
        SeamFinder finder = new SeamFinder(9, 6);

        for (int k = 0; k < 9; k++) {
            List<Pos> seam = finder.extractSeam(GradientEnergy.of(carved));
            assertEquals(6, seam.size());
            for (int i = 0; i < seam.size(); i++) {
                assertEquals(5 - i, seam.get(i).y, "Seam is ordered from the bottom row up");
                assertTrue(seam.get(i).x < carved.getWidth());
                if (i > 0) {
                    assertTrue(Math.abs(seam.get(i).x - seam.get(i - 1).x) <= 1, "Seam must be connected");
                }
            }
            carved.removeSeam(seam);
        }
        assertEquals(0, carved.getWidth());
        assertThrows(IllegalStateException.class, () -> finder.extractSeam(p -> 0));
    }

    @Test
    public void testCachedSeamsMatchFullRecomputation() {
        Random rnd = new Random(42);
        int[] maxValues = { 1, 3, 255 };

        for (int trial = 0; trial < 300; trial++) {
            int w = 1 + rnd.nextInt(12);
            int h = 1 + rnd.nextInt(9);
            int channels = rnd.nextBoolean() ? 1 : 3;
            RasterImage img = randomImage(rnd, w, h, channels, maxValues[rnd.nextInt(maxValues.length)]);

            CarvedGrid carved = new CarvedGrid(img);
            SeamFinder finder = new SeamFinder(w, h);
            for (int k = 0; k < w; k++) {
                List<Pos> expected = BruteForceSeams.find(carved);
                List<Pos> actual = finder.extractSeam(GradientEnergy.of(carved));
                assertEquals(expected, actual, "trial " + trial + " (" + w + "x" + h + "), seam " + k);
                carved.removeSeam(actual);
            }
        }
    }

    @Test
    public void testCachedSeamsMatchOnFlatRegions() {
        // Large equal-cost areas exercise the lowest-x tie breaking
        RasterImage img = RasterImage.grayscale(new int[][] {
                { 0, 0, 0, 0, 0, 0 },
                { 0, 0, 9, 0, 0, 0 },
                { 0, 0, 0, 0, 9, 0 },
                { 0, 0, 0, 0, 0, 0 } });
        CarvedGrid carved = new CarvedGrid(img);
        SeamFinder finder = new SeamFinder(6, 4);

        for (int k = 0; k < 6; k++) {
            List<Pos> expected = BruteForceSeams.find(carved);
            List<Pos> actual = finder.extractSeam(GradientEnergy.of(carved));
            assertEquals(expected, actual, "seam " + k);
            carved.removeSeam(actual);
        }
    }
}
