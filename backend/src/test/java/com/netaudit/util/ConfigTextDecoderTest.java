package com.netaudit.util;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTextDecoderTest {

    @Test
    void shouldDecodePlainUtf8WithoutNotice() {
        ConfigTextDecoder.DecodedConfig decoded = ConfigTextDecoder.decode("hostname R1\n".getBytes(StandardCharsets.UTF_8));

        assertEquals("hostname R1\n", decoded.text());
        assertEquals(StandardCharsets.UTF_8, decoded.charset());
        assertNull(decoded.notice("r1.cfg"));
    }

    @Test
    void shouldNormalizeWindowsLineEndings() {
        byte[] bytes = "hostname R1\r\nline vty 0 4\r\n exec-timeout 5 0\rend".getBytes(StandardCharsets.UTF_8);

        assertEquals("hostname R1\nline vty 0 4\n exec-timeout 5 0\nend", ConfigTextDecoder.decode(bytes).text());
    }

    @Test
    void shouldStripUtf8Bom() {
        byte[] body = "enable secret 5 x".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[body.length + 3];
        bytes[0] = (byte) 0xEF;
        bytes[1] = (byte) 0xBB;
        bytes[2] = (byte) 0xBF;
        System.arraycopy(body, 0, bytes, 3, body.length);

        ConfigTextDecoder.DecodedConfig decoded = ConfigTextDecoder.decode(bytes);

        assertEquals("enable secret 5 x", decoded.text());
        assertFalse(decoded.converted());
    }

    @Test
    void shouldDecodeUtf16WithBomAndReportIt() {
        byte[] body = "ntp server 10.0.0.1\r\n".getBytes(StandardCharsets.UTF_16LE);
        byte[] bytes = new byte[body.length + 2];
        bytes[0] = (byte) 0xFF;
        bytes[1] = (byte) 0xFE;
        System.arraycopy(body, 0, bytes, 2, body.length);

        ConfigTextDecoder.DecodedConfig decoded = ConfigTextDecoder.decode(bytes);

        assertEquals("ntp server 10.0.0.1\n", decoded.text());
        assertEquals(StandardCharsets.UTF_16LE, decoded.charset());
        assertTrue(decoded.notice("r1.cfg").contains("UTF-16LE"));
    }

    @Test
    void shouldFallBackToLatin1ForInvalidUtf8() {
        byte[] bytes = {'b', 'a', 'n', 'n', 'e', 'r', ' ', (byte) 0xE9};

        ConfigTextDecoder.DecodedConfig decoded = ConfigTextDecoder.decode(bytes);

        assertEquals("banner é", decoded.text());
        assertTrue(decoded.converted());
        assertTrue(decoded.notice("r1.cfg").contains("ISO-8859-1"));
    }

    @Test
    void shouldHandleEmptyInput() {
        assertEquals("", ConfigTextDecoder.decode(new byte[0]).text());
        assertEquals("", ConfigTextDecoder.decode(null).text());
    }
}
