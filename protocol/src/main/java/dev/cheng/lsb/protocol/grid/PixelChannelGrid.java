package dev.cheng.lsb.protocol.grid;

/**
 * Mutable row-major grid of RGB pixels with 8-bit channels.
 * <p>
 * Dimensions never change for the lifetime of a grid.
 */
public interface PixelChannelGrid {

    int width();

    int height();

    /**
     * @return channel value in {@code 0..255}
     */
    int channel(int row, int col, Channel channel);

    /**
     * @param value channel value in {@code 0..255}
     */
    void setChannel(int row, int col, Channel channel, int value);
}
