package dev.cheng.lsb.protocol.codec;

import dev.cheng.lsb.protocol.LsbConstants;
import dev.cheng.lsb.protocol.grid.Channel;
import dev.cheng.lsb.protocol.grid.PixelChannelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Walks the 1-bit locations of a grid in embedding order.
 * <p>
 * Order: red, green, blue of pixel (0, 0), then the next column, then the next row. After the last
 * pixel the cursor wraps to (0, 0) on the next more significant bit plane. Once every plane up to
 * {@link #planeLimit()} has been consumed the cursor is exhausted: it can still be inspected but no
 * longer read, written or advanced.
 */
public final class ChannelCursor {
    private static final Logger log = LoggerFactory.getLogger(ChannelCursor.class);

    private final PixelChannelGrid grid;
    private final int planeLimit;
    private int row;
    private int col;
    private Channel channel;
    private int planeIndex;

    public ChannelCursor(PixelChannelGrid grid) {
        this(grid, LsbConstants.MAX_BIT_PLANES);
    }

    /**
     * @param planeLimit number of bit planes the cursor may visit, {@code 1..8}
     */
    public ChannelCursor(PixelChannelGrid grid, int planeLimit) {
        this.grid = Objects.requireNonNull(grid, "grid");
        if (planeLimit < 1 || planeLimit > LsbConstants.MAX_BIT_PLANES) {
            throw new IllegalArgumentException("Plane limit out of range: " + planeLimit);
        }
        this.planeLimit = planeLimit;
        this.channel = Channel.RED;
    }

    /**
     * Full 8-bit value of the addressed channel.
     */
    public int currentValue() {
        checkNotExhausted();
        return grid.channel(row, col, channel);
    }

    /**
     * Overwrites the whole addressed channel. Callers keep every bit except the one at
     * {@link #planeIndex()} intact.
     */
    public void setValue(int value) {
        checkNotExhausted();
        if (value < 0 || value > LsbConstants.CHANNEL_MASK) {
            throw new IllegalArgumentException("Channel value out of range: " + value);
        }
        grid.setChannel(row, col, channel, value);
    }

    public void advance() {
        checkNotExhausted();
        Channel next = channel.next();
        if (next != null) {
            channel = next;
            return;
        }
        channel = Channel.RED;
        if (col < grid.width() - 1) {
            col++;
        } else if (row < grid.height() - 1) {
            row++;
            col = 0;
        } else {
            row = 0;
            col = 0;
            planeIndex++;
            log.debug("Wrapped around {}x{} grid, now on plane {}", grid.width(), grid.height(), planeIndex);
        }
    }

    public int planeIndex() {
        return planeIndex;
    }

    public int planeLimit() {
        return planeLimit;
    }

    public boolean isExhausted() {
        return planeIndex >= planeLimit;
    }

    public CursorPosition position() {
        return new CursorPosition(row, col, channel, planeIndex);
    }

    /**
     * Every bit set except bit {@code planeIndex}.
     */
    public static int writeMask(int planeIndex) {
        return ~readMask(planeIndex) & LsbConstants.CHANNEL_MASK;
    }

    /**
     * Only bit {@code planeIndex} set.
     */
    public static int readMask(int planeIndex) {
        if (planeIndex < 0 || planeIndex >= LsbConstants.MAX_BIT_PLANES) {
            throw new IllegalArgumentException("Bit plane out of range: " + planeIndex);
        }
        return 1 << planeIndex;
    }

    private void checkNotExhausted() {
        if (isExhausted()) {
            throw new IllegalStateException("Cursor exhausted all " + planeLimit + " bit planes");
        }
    }
}
