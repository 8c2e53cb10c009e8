package dev.cheng.lsb.protocol;

import dev.cheng.lsb.protocol.codec.FrameCodec;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class ConstantsTest {

    @Test
    void testDefaultsWithoutConfigFile() {
        assertEquals(LsbConstants.MAX_BIT_PLANES, Constants.BIT_PLANES);
        assertEquals(StandardCharsets.UTF_8, Constants.MESSAGE_CHARSET);
        assertEquals("bmp", Constants.DEFAULT_FORMAT);
    }

    @Test
    void testDefaultCodecUsesConfiguredPlanes() {
        assertEquals(Constants.BIT_PLANES, new FrameCodec().getBitPlanes());
    }

    @Test
    void testMalformedIntegerFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty("lsb.bitPlanes", "eight");
        assertEquals(8, Constants.readInt(properties, "lsb.bitPlanes", 8));

        properties.setProperty("lsb.bitPlanes", "   ");
        assertEquals(8, Constants.readInt(properties, "lsb.bitPlanes", 8));

        properties.setProperty("lsb.bitPlanes", " 3 ");
        assertEquals(3, Constants.readInt(properties, "lsb.bitPlanes", 8));

        assertEquals(8, Constants.readInt(new Properties(), "lsb.bitPlanes", 8));
    }

    @Test
    void testUnknownCharsetFallsBackToDefault() {
        Properties properties = new Properties();
        properties.setProperty("lsb.charset", "no-such-charset");
        assertEquals(StandardCharsets.UTF_8, Constants.readCharset(properties, "lsb.charset", StandardCharsets.UTF_8));

        properties.setProperty("lsb.charset", "ISO-8859-1");
        assertEquals(StandardCharsets.ISO_8859_1, Constants.readCharset(properties, "lsb.charset", StandardCharsets.UTF_8));
    }

    @Test
    void testStringTrimmedOrDefaulted() {
        Properties properties = new Properties();
        assertEquals("bmp", Constants.readString(properties, "lsb.defaultFormat", "bmp"));
        properties.setProperty("lsb.defaultFormat", " png ");
        assertEquals("png", Constants.readString(properties, "lsb.defaultFormat", "bmp"));
    }

    @Test
    void testFrameLimits() {
        assertEquals(65_535, LsbConstants.MAX_MESSAGE_BYTES);
        assertEquals(16, LsbConstants.LENGTH_FIELD_BITS);
    }
}
