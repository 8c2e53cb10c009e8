package dev.cheng.lsb.protocol;

/**
 * Fixed constants of the embedded frame layout.
 */
public final class LsbConstants {
    public static final int BITS_PER_BYTE = Byte.SIZE;
    public static final int LENGTH_FIELD_BITS = Short.SIZE;
    public static final int MAX_MESSAGE_BYTES = (1 << LENGTH_FIELD_BITS) - 1;
    public static final int CHANNELS_PER_PIXEL = 3;
    public static final int MAX_BIT_PLANES = BITS_PER_BYTE;
    public static final int CHANNEL_MASK = 0xFF;

    private LsbConstants() {
    }
}
