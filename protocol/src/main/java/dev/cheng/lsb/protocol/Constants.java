package dev.cheng.lsb.protocol;

import dev.cheng.lsb.protocol.grid.BitmapIO;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Properties;

/**
 * Tunable settings, read once from {@code lsb.properties} (or the file named by {@code -Dlsb.config}).
 */
public final class Constants {

    private static final Properties PROPERTIES = loadProperties();

    private Constants() {
    }

    // Bit planes the codec may spill into, starting from the least significant one.
    public static final int BIT_PLANES = readInt(PROPERTIES, "lsb.bitPlanes", LsbConstants.MAX_BIT_PLANES);

    // Charset used for text messages on the command line and in the facade.
    public static final Charset MESSAGE_CHARSET = readCharset(PROPERTIES, "lsb.charset", StandardCharsets.UTF_8);

    // Container written when the destination path carries no extension.
    public static final String DEFAULT_FORMAT = readString(PROPERTIES, "lsb.defaultFormat", "bmp").toLowerCase(Locale.ROOT);

    static {
        if (BIT_PLANES < 1 || BIT_PLANES > LsbConstants.MAX_BIT_PLANES) {
            throw new IllegalArgumentException("Invalid bit plane count: " + BIT_PLANES);
        }
        if (!BitmapIO.LOSSLESS_FORMATS.contains(DEFAULT_FORMAT)) {
            throw new IllegalArgumentException("Default format must be lossless: " + DEFAULT_FORMAT);
        }
    }

    private static Properties loadProperties() {
        Properties properties = new Properties();
        Path configPath = Paths.get(System.getProperty("lsb.config", "lsb.properties"));
        if (Files.isRegularFile(configPath)) {
            try (InputStream inputStream = Files.newInputStream(configPath)) {
                properties.load(inputStream);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read configuration " + configPath, e);
            }
        }
        return properties;
    }

    static int readInt(Properties properties, String key, int defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    static String readString(Properties properties, String key, String defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    static Charset readCharset(Properties properties, String key, Charset defaultValue) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Charset.forName(value.trim());
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
