package dev.cheng.lsb.protocol;

/**
 * The frame does not fit into the image, or the message is longer than the length field can express.
 */
public class CapacityException extends StegoException {
    private final long requiredBits;
    private final long availableBits;

    public CapacityException(String message, long requiredBits, long availableBits) {
        super(message);
        this.requiredBits = requiredBits;
        this.availableBits = availableBits;
    }

    public long getRequiredBits() {
        return requiredBits;
    }

    public long getAvailableBits() {
        return availableBits;
    }
}
