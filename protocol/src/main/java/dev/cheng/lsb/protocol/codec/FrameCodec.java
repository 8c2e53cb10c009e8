package dev.cheng.lsb.protocol.codec;

import dev.cheng.lsb.protocol.CapacityException;
import dev.cheng.lsb.protocol.Constants;
import dev.cheng.lsb.protocol.LsbConstants;
import dev.cheng.lsb.protocol.grid.PixelChannelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Frame codec
 * <p>
 * Embeds a length-prefixed message into the bit planes of a grid and extracts it again.
 * The frame is a 16-bit length (bytes, MSB first) followed by the message bytes, each MSB first.
 * Every bit goes to the bit plane the {@link ChannelCursor} is on when it is written, so a frame
 * that does not fit into the least significant bits spills into the next plane.
 * <p>
 * There is no marker or checksum: extracting from an image that was never embedded returns
 * whatever the bits happen to say.
 */
public class FrameCodec {
    private static final Logger log = LoggerFactory.getLogger(FrameCodec.class);

    private final int bitPlanes;

    public FrameCodec() {
        this(Constants.BIT_PLANES);
    }

    /**
     * @param bitPlanes number of bit planes the codec may use, {@code 1..8}
     */
    public FrameCodec(int bitPlanes) {
        if (bitPlanes < 1 || bitPlanes > LsbConstants.MAX_BIT_PLANES) {
            throw new IllegalArgumentException("Bit plane count out of range: " + bitPlanes);
        }
        this.bitPlanes = bitPlanes;
    }

    public int getBitPlanes() {
        return bitPlanes;
    }

    /**
     * Largest message this codec can embed into the grid.
     */
    public int getMessageCapacity(PixelChannelGrid grid) {
        return FrameCapacity.maxMessageBytes(grid.width(), grid.height(), bitPlanes);
    }

    /**
     * Validates the frame size against the grid.
     */
    public void checkCapacity(long messageLength, PixelChannelGrid grid) throws CapacityException {
        FrameCapacity.check(messageLength, grid.width(), grid.height(), bitPlanes);
    }

    /**
     * Embeds {@code message} into {@code grid}.
     * <p>
     * Capacity is validated before the first pixel is touched, so a failed call leaves the grid unchanged.
     *
     * @return cursor positioned just past the last bit written
     */
    public ChannelCursor encode(byte[] message, PixelChannelGrid grid) throws CapacityException {
        Objects.requireNonNull(message, "message");
        checkCapacity(message.length, grid);

        ChannelCursor cursor = new ChannelCursor(grid, bitPlanes);
        writeBits(cursor, message.length, LsbConstants.LENGTH_FIELD_BITS);
        for (byte b : message) {
            writeBits(cursor, b & 0xFF, LsbConstants.BITS_PER_BYTE);
        }
        log.debug("Embedded {} byte message into {}x{} grid across {} bit plane(s)",
                message.length, grid.width(), grid.height(),
                FrameCapacity.planesUsed(message.length, grid.width(), grid.height()));
        return cursor;
    }

    /**
     * Extracts the message embedded in {@code grid}. Never modifies the grid.
     *
     * @throws CapacityException if the grid cannot hold a length field, or the decoded length
     *                           would need more bits than the grid has
     */
    public byte[] decode(PixelChannelGrid grid) throws CapacityException {
        checkCapacity(0, grid);

        ChannelCursor cursor = new ChannelCursor(grid, bitPlanes);
        int length = readBits(cursor, LsbConstants.LENGTH_FIELD_BITS);
        try {
            checkCapacity(length, grid);
        } catch (CapacityException e) {
            throw new CapacityException("Corrupt or foreign image, declared message length " + length
                    + " does not fit: " + e.getMessage(), e.getRequiredBits(), e.getAvailableBits());
        }

        byte[] message = new byte[length];
        for (int i = 0; i < length; i++) {
            message[i] = (byte) readBits(cursor, LsbConstants.BITS_PER_BYTE);
        }
        log.debug("Extracted {} byte message from {}x{} grid", length, grid.width(), grid.height());
        return message;
    }

    /**
     * Writes the low {@code bitCount} bits of {@code value}, most significant first.
     */
    private static void writeBits(ChannelCursor cursor, int value, int bitCount) {
        for (int shift = bitCount - 1; shift >= 0; shift--) {
            int plane = cursor.planeIndex();
            int bit = ((value >> shift) & 1) << plane;
            cursor.setValue((cursor.currentValue() & ChannelCursor.writeMask(plane)) | bit);
            cursor.advance();
        }
    }

    /**
     * Reads {@code bitCount} bits, most significant first.
     */
    private static int readBits(ChannelCursor cursor, int bitCount) {
        int value = 0;
        for (int i = 0; i < bitCount; i++) {
            int plane = cursor.planeIndex();
            int bit = (cursor.currentValue() & ChannelCursor.readMask(plane)) >> plane;
            value |= bit << (bitCount - 1 - i);
            cursor.advance();
        }
        return value;
    }
}
