package dev.cheng.lsb.protocol;

import dev.cheng.lsb.protocol.codec.FrameCodec;
import dev.cheng.lsb.protocol.grid.BitmapIO;
import dev.cheng.lsb.protocol.grid.BufferedImagePixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Hides messages in bitmap files and recovers them.
 * <p>
 * Decoded messages carry no validity signal: an image that was never embedded decodes to garbage.
 */
public final class LsbStego {
    private static final Logger log = LoggerFactory.getLogger(LsbStego.class);

    private final FrameCodec codec;

    public LsbStego() {
        this(new FrameCodec());
    }

    public LsbStego(FrameCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Embeds {@code message} into the pixels of {@code source} and writes the result to {@code destination}.
     * Nothing is written when the message does not fit.
     */
    public void encode(byte[] message, Path source, Path destination) throws IOException, StegoException {
        BitmapIO.formatFor(destination);
        BufferedImagePixelGrid grid = BitmapIO.load(source);
        codec.encode(message, grid);
        BitmapIO.save(grid, destination);
        log.info("Encoded {} bytes from {} into {}", message.length, source, destination);
    }

    public void encode(String message, Path source, Path destination) throws IOException, StegoException {
        encode(message.getBytes(Constants.MESSAGE_CHARSET), source, destination);
    }

    public byte[] decode(Path source) throws IOException, StegoException {
        BufferedImagePixelGrid grid = BitmapIO.load(source);
        byte[] message = codec.decode(grid);
        log.info("Decoded {} bytes from {}", message.length, source);
        return message;
    }

    public String decodeText(Path source) throws IOException, StegoException {
        return new String(decode(source), Constants.MESSAGE_CHARSET);
    }

    /**
     * Largest message, in bytes, that {@code source} can carry.
     */
    public int capacity(Path source) throws IOException, StegoException {
        return codec.getMessageCapacity(BitmapIO.load(source));
    }
}
