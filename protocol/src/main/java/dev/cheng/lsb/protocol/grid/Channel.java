package dev.cheng.lsb.protocol.grid;

/**
 * Color channels of an RGB pixel, declared in traversal order.
 */
public enum Channel {

    RED(16),
    GREEN(8),
    BLUE(0);

    // Offset inside a packed 0xRRGGBB value.
    private final int shift;

    Channel(int shift) {
        this.shift = shift;
    }

    public int extract(int rgb) {
        return (rgb >> shift) & 0xFF;
    }

    public int replace(int rgb, int value) {
        return (rgb & ~(0xFF << shift)) | ((value & 0xFF) << shift);
    }

    /**
     * Next channel within the same pixel, or {@code null} after blue.
     */
    public Channel next() {
        switch (this) {
            case RED:
                return GREEN;
            case GREEN:
                return BLUE;
            default:
                return null;
        }
    }
}
