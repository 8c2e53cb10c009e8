package dev.cheng.lsb.protocol.grid;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * {@link PixelChannelGrid} over a 24-bit RGB {@link BufferedImage}.
 * <p>
 * Rows map to the image's y axis and columns to its x axis.
 */
public final class BufferedImagePixelGrid implements PixelChannelGrid {
    private final BufferedImage image;

    public BufferedImagePixelGrid(BufferedImage image) {
        this.image = Objects.requireNonNull(image, "image");
        if (image.getColorModel().hasAlpha()) {
            throw new IllegalArgumentException("Images with an alpha channel are not supported");
        }
        if (image.getWidth() <= 0 || image.getHeight() <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive");
        }
    }

    /**
     * Creates a black grid of the given size.
     */
    public static BufferedImagePixelGrid blank(int width, int height) {
        return new BufferedImagePixelGrid(new BufferedImage(width, height, BufferedImage.TYPE_3BYTE_BGR));
    }

    public BufferedImage image() {
        return image;
    }

    @Override
    public int width() {
        return image.getWidth();
    }

    @Override
    public int height() {
        return image.getHeight();
    }

    @Override
    public int channel(int row, int col, Channel channel) {
        checkBounds(row, col);
        return channel.extract(image.getRGB(col, row));
    }

    @Override
    public void setChannel(int row, int col, Channel channel, int value) {
        checkBounds(row, col);
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException("Channel value out of range: " + value);
        }
        int rgb = image.getRGB(col, row) & 0xFFFFFF;
        image.setRGB(col, row, 0xFF000000 | channel.replace(rgb, value));
    }

    /**
     * Packed {@code 0xRRGGBB} value of one pixel.
     */
    public int rgb(int row, int col) {
        checkBounds(row, col);
        return image.getRGB(col, row) & 0xFFFFFF;
    }

    public void setRgb(int row, int col, int rgb) {
        checkBounds(row, col);
        image.setRGB(col, row, 0xFF000000 | (rgb & 0xFFFFFF));
    }

    /**
     * Deep copy backed by a new image.
     */
    public BufferedImagePixelGrid copy() {
        BufferedImage clone = new BufferedImage(width(), height(), BufferedImage.TYPE_3BYTE_BGR);
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                clone.setRGB(x, y, image.getRGB(x, y));
            }
        }
        return new BufferedImagePixelGrid(clone);
    }

    private void checkBounds(int row, int col) {
        if (row < 0 || row >= height() || col < 0 || col >= width()) {
            throw new IndexOutOfBoundsException("Pixel (" + row + ", " + col + ") outside "
                    + width() + "x" + height() + " grid");
        }
    }
}
