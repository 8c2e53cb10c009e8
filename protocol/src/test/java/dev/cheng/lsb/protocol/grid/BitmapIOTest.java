package dev.cheng.lsb.protocol.grid;

import dev.cheng.lsb.protocol.StegoException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BitmapIOTest {

    @TempDir
    Path tempDir;

    private static BufferedImagePixelGrid gradient(int width, int height) {
        BufferedImagePixelGrid grid = BufferedImagePixelGrid.blank(width, height);
        for (int row = 0; row < height; row++) {
            for (int col = 0; col < width; col++) {
                grid.setRgb(row, col, (row * 37) << 16 | (col * 53) << 8 | (row + col) * 11);
            }
        }
        return grid;
    }

    private static void assertSamePixels(BufferedImagePixelGrid expected, BufferedImagePixelGrid actual) {
        assertEquals(expected.width(), actual.width());
        assertEquals(expected.height(), actual.height());
        for (int row = 0; row < expected.height(); row++) {
            for (int col = 0; col < expected.width(); col++) {
                assertEquals(expected.rgb(row, col), actual.rgb(row, col), "pixel " + row + "," + col);
            }
        }
    }

    @Test
    void testBitmapRoundTrip() throws IOException, StegoException {
        BufferedImagePixelGrid grid = gradient(5, 3);
        Path file = tempDir.resolve("nested/out.bmp");

        BitmapIO.save(grid, file);

        assertTrue(Files.isRegularFile(file));
        assertSamePixels(grid, BitmapIO.load(file));
    }

    @Test
    void testPngRoundTrip() throws IOException, StegoException {
        BufferedImagePixelGrid grid = gradient(4, 6);
        Path file = tempDir.resolve("out.PNG");

        BitmapIO.save(grid, file);

        assertSamePixels(grid, BitmapIO.load(file));
    }

    @Test
    void testIntRgbInputIsNormalized() throws IOException, StegoException {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_RGB);
        image.setRGB(1, 0, 0x00FF7F);
        Path file = tempDir.resolve("int.png");
        ImageIO.write(image, "png", file.toFile());

        BufferedImagePixelGrid grid = BitmapIO.load(file);

        assertEquals(BufferedImage.TYPE_3BYTE_BGR, grid.image().getType());
        assertEquals(0x7F, grid.channel(0, 1, Channel.BLUE));
        assertEquals(0xFF, grid.channel(0, 1, Channel.GREEN));
    }

    @Test
    void testAlphaRejected() throws IOException {
        BufferedImage image = new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB);
        Path file = tempDir.resolve("alpha.png");
        ImageIO.write(image, "png", file.toFile());

        assertThrows(StegoException.class, () -> BitmapIO.load(file));
    }

    @Test
    void testUnreadableFileRejected() throws IOException {
        Path file = tempDir.resolve("notes.bmp");
        Files.writeString(file, "not an image");

        assertThrows(StegoException.class, () -> BitmapIO.load(file));
    }

    @Test
    void testFormatForDestination() throws StegoException {
        assertEquals("bmp", BitmapIO.formatFor(Path.of("a/b/out.bmp")));
        assertEquals("png", BitmapIO.formatFor(Path.of("out.Png")));
        assertEquals("bmp", BitmapIO.formatFor(Path.of("out")));
        assertThrows(StegoException.class, () -> BitmapIO.formatFor(Path.of("out.jpg")));
    }

    @Test
    void testLosslessFormatsHaveWriters() {
        for (String format : BitmapIO.LOSSLESS_FORMATS) {
            assertTrue(ImageIO.getImageWritersByFormatName(format).hasNext(), format);
        }
    }

    @Test
    void testLossyDestinationNotWritten() {
        Path file = tempDir.resolve("out.jpeg");
        assertThrows(StegoException.class, () -> BitmapIO.save(gradient(2, 2), file));
        assertFalse(Files.exists(file));
    }
}
