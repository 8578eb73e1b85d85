package de.bsommerfeld.coversync.db;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

class InlinePayloadDecoderTest {

    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, 0x01, 0x02};

    @Test
    void decode_shouldPassBlobsThrough() {
        assertArrayEquals(JPEG, InlinePayloadDecoder.decode(JPEG));
    }

    @Test
    void decode_shouldDecodePlainBase64() {
        String text = Base64.getEncoder().encodeToString(JPEG);
        assertArrayEquals(JPEG, InlinePayloadDecoder.decode(text));
    }

    @Test
    void decode_shouldStripDataUriPrefix() {
        String text = "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(JPEG);
        assertArrayEquals(JPEG, InlinePayloadDecoder.decode(text));
    }

    @Test
    void decode_shouldTolerateLineBreaks() {
        String text = new String(Base64.getMimeEncoder().encode(new byte[200]), StandardCharsets.US_ASCII);
        assertTrue(text.contains("\r\n"));
        assertEquals(200, InlinePayloadDecoder.decode(text).length);
    }

    @Test
    void decode_shouldRejectInvalidBase64() {
        assertThrows(IllegalArgumentException.class, () -> InlinePayloadDecoder.decode("not base64 !!"));
    }

    @Test
    void decode_shouldRejectEmptyPayloads() {
        assertThrows(IllegalArgumentException.class, () -> InlinePayloadDecoder.decode(new byte[0]));
        assertThrows(IllegalArgumentException.class, () -> InlinePayloadDecoder.decode("   "));
        assertThrows(IllegalArgumentException.class, () -> InlinePayloadDecoder.decode("data:image/png;base64,"));
    }

    @Test
    void decode_shouldRejectUnexpectedTypes() {
        assertThrows(IllegalArgumentException.class, () -> InlinePayloadDecoder.decode(42L));
        assertThrows(IllegalArgumentException.class, () -> InlinePayloadDecoder.decode(null));
    }
}
