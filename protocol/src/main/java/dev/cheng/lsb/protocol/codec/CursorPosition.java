package dev.cheng.lsb.protocol.codec;

import dev.cheng.lsb.protocol.grid.Channel;

/**
 * Snapshot of where a {@link ChannelCursor} points.
 */
public record CursorPosition(
        int row,
        int col,
        Channel channel,
        int planeIndex
) {
    @Override
    public String toString() {
        return String.format("CursorPosition{row=%d, col=%d, channel=%s, plane=%d}",
                row, col, channel, planeIndex);
    }
}
