package dev.cheng.lsb.protocol.codec;

import dev.cheng.lsb.protocol.CapacityException;
import dev.cheng.lsb.protocol.LsbConstants;

/**
 * Bit budget of a frame against the addressable bit planes of an image.
 */
public final class FrameCapacity {

    private FrameCapacity() {
    }

    /**
     * Bits needed for the length field plus {@code messageLength} bytes.
     */
    public static long requiredBits(long messageLength) {
        return LsbConstants.LENGTH_FIELD_BITS + (long) LsbConstants.BITS_PER_BYTE * messageLength;
    }

    public static long availableBits(int width, int height, int bitPlanes) {
        return (long) LsbConstants.CHANNELS_PER_PIXEL * width * height * bitPlanes;
    }

    /**
     * Number of bit planes a frame of {@code messageLength} bytes touches.
     */
    public static int planesUsed(long messageLength, int width, int height) {
        long bitsPerPlane = availableBits(width, height, 1);
        return (int) ((requiredBits(messageLength) + bitsPerPlane - 1) / bitsPerPlane);
    }

    /**
     * Largest message, in bytes, that fits into the image.
     */
    public static int maxMessageBytes(int width, int height, int bitPlanes) {
        long spare = availableBits(width, height, bitPlanes) - LsbConstants.LENGTH_FIELD_BITS;
        if (spare < 0) {
            return 0;
        }
        return (int) Math.min(spare / LsbConstants.BITS_PER_BYTE, LsbConstants.MAX_MESSAGE_BYTES);
    }

    /**
     * @throws CapacityException if the message is longer than the length field allows or the frame
     *                           does not fit into the image
     */
    public static void check(long messageLength, int width, int height, int bitPlanes) throws CapacityException {
        long required = requiredBits(messageLength);
        long available = availableBits(width, height, bitPlanes);
        if (messageLength < 0) {
            throw new CapacityException("Negative message length: " + messageLength, required, available);
        }
        if (messageLength > LsbConstants.MAX_MESSAGE_BYTES) {
            throw new CapacityException("Message length " + messageLength + " exceeds maximum of "
                    + LsbConstants.MAX_MESSAGE_BYTES + " bytes", required, available);
        }
        if (required > available) {
            throw new CapacityException("Image is not large enough to hold message: needs " + required
                    + " bits but " + width + "x" + height + " offers " + available, required, available);
        }
    }
}
