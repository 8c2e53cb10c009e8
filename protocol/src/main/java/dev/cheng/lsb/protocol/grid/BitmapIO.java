package dev.cheng.lsb.protocol.grid;

import dev.cheng.lsb.protocol.Constants;
import dev.cheng.lsb.protocol.StegoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Reads and writes lossless bitmap containers holding 24-bit RGB pixels.
 */
public final class BitmapIO {
    private static final Logger log = LoggerFactory.getLogger(BitmapIO.class);

    /**
     * Containers that keep every pixel bit intact.
     */
    public static final Set<String> LOSSLESS_FORMATS = Set.of("bmp", "png");

    private BitmapIO() {
    }

    /**
     * Loads an image and normalizes it to 24-bit RGB.
     *
     * @throws StegoException if the file is not a readable image or carries an alpha channel
     */
    public static BufferedImagePixelGrid load(Path input) throws IOException, StegoException {
        BufferedImage source = ImageIO.read(input.toFile());
        if (source == null) {
            throw new StegoException("Unsupported or unreadable image: " + input);
        }
        if (source.getColorModel().hasAlpha()) {
            throw new StegoException("Images with an alpha channel are not supported: " + input);
        }
        log.debug("Loaded {} ({}x{}, type {})", input, source.getWidth(), source.getHeight(), source.getType());
        return new BufferedImagePixelGrid(toRgb(source));
    }

    /**
     * Writes the grid in the container named by the destination's extension.
     *
     * @throws StegoException if the extension names a lossy or unknown container
     */
    public static void save(BufferedImagePixelGrid grid, Path output) throws IOException, StegoException {
        String format = formatFor(output);
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        if (!ImageIO.write(grid.image(), format, output.toFile())) {
            throw new IOException("No ImageIO writer available for " + format);
        }
        log.debug("Saved {} as {} ({}x{})", output, format, grid.width(), grid.height());
    }

    /**
     * Container format for a destination path.
     */
    public static String formatFor(Path output) throws StegoException {
        Path fileName = output.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return Constants.DEFAULT_FORMAT;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        if (!LOSSLESS_FORMATS.contains(extension)) {
            throw new StegoException("Unsupported output format '" + extension
                    + "', expected one of " + LOSSLESS_FORMATS);
        }
        return extension;
    }

    private static BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_3BYTE_BGR) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_3BYTE_BGR);
        for (int y = 0; y < source.getHeight(); y++) {
            for (int x = 0; x < source.getWidth(); x++) {
                rgb.setRGB(x, y, source.getRGB(x, y));
            }
        }
        return rgb;
    }
}
