package com.seamcarving.server.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.File;

import static org.junit.jupiter.api.Assertions.*;

public class ImageResizeToolTest {

    @Test
    public void testWritesResizedFileNextToInput(@TempDir File dir) throws Exception {
        BufferedImage img = new BufferedImage(6, 5, BufferedImage.TYPE_INT_RGB);
        img.setRGB(2, 2, 0xffffff);
        File input = new File(dir, "photo.png");
        assertTrue(ImageIO.write(img, "png", input));

        File output = ImageResizeTool.run(input, 4, 3, "_resized");

        assertEquals(new File(dir, "photo_resized.png").getAbsoluteFile(), output);
        BufferedImage resized = ImageIO.read(output);
        assertEquals(4, resized.getWidth());
        assertEquals(3, resized.getHeight());
    }

    @Test
    public void testOutputFileName() {
        File out = ImageResizeTool.outputFile(new File("/tmp/a.b.jpg"), "_small");
        assertEquals("a.b_small.jpg", out.getName());

        assertThrows(IllegalArgumentException.class, () -> ImageResizeTool.outputFile(new File("noext"), "_x"));
    }
}
