package com.ginindex.compress;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ginindex.storage.CorruptIndexException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;

class Lz4CompressionCodecTest {

    private final CompressionCodec codec = Lz4CompressionCodec.INSTANCE;

    @Test
    void testRoundTrip() throws IOException {
        byte[] raw = "term-".repeat(10_000).getBytes(StandardCharsets.UTF_8);

        byte[] compressed = codec.compress(raw);

        assertEquals("lz4", codec.name());
        assertTrue(compressed.length < raw.length);
        assertArrayEquals(raw, codec.decompress(compressed, raw.length));
    }

    @Test
    void testEmptyInput() throws IOException {
        byte[] compressed = codec.compress(new byte[0]);
        assertArrayEquals(new byte[0], codec.decompress(compressed, 0));
    }

    @Test
    void testWrongExpectedSizeIsCorrupt() {
        byte[] raw = "abcabcabcabcabcabcabc".repeat(100).getBytes(StandardCharsets.UTF_8);
        byte[] compressed = codec.compress(raw);

        assertThrows(CorruptIndexException.class, () -> codec.decompress(compressed, raw.length - 1));
        assertThrows(CorruptIndexException.class, () -> codec.decompress(compressed, -1));
    }

    @Test
    void testGarbageIsCorrupt() {
        byte[] garbage = new byte[64];
        Arrays.fill(garbage, (byte) 0xF0);

        assertThrows(CorruptIndexException.class, () -> codec.decompress(garbage, 1024));
    }

    @Test
    void testExpectedSizeBeyondMaxRatioIsCorrupt() {
        byte[] compressed = codec.compress(new byte[1000]);

        assertThrows(CorruptIndexException.class, () -> codec.decompress(compressed, Integer.MAX_VALUE - 8));
    }
}
