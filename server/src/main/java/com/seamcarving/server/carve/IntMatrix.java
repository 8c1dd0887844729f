package com.seamcarving.server.carve;

import java.util.function.IntBinaryOperator;

public class IntMatrix extends ShrinkableMatrix {

    private final int[] contents;

    public IntMatrix(int width, int height, IntBinaryOperator init) {
        super(width, height);
        this.contents = new int[width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                contents[index(x, y)] = init.applyAsInt(x, y);
            }
        }
    }

    public int get(int x, int y) {
        return contents[index(x, y)];
    }

    @Override
    protected void rotateLeft(int from, int to) {
        if (to - from < 2) {
            return;
        }
        int first = contents[from];
        System.arraycopy(contents, from + 1, contents, from, to - from - 1);
        contents[to - 1] = first;
    }
}
