package com.ginindex.store;

import static com.ginindex.store.GinIndexStoreTest.addRow;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.ginindex.config.StoreConfig;
import com.ginindex.storage.LocalPartStorage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PostingsCacheForStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void testQueryStringCachedOnce() throws IOException {
        LocalPartStorage storage = new LocalPartStorage(tempDir);
        GinIndexStore writer = new GinIndexStore("title", storage, StoreConfig.withDigestionThreshold(1L));
        addRow(writer, "hello", 1);
        writer.writeSegment();
        addRow(writer, "hello", 2);
        addRow(writer, "world", 2);
        writer.finalizeStore();

        GinIndexStore store = new GinIndexStore("title", storage);
        PostingsCacheForStore cacheForStore = new PostingsCacheForStore(store);
        assertSame(store, cacheForStore.getStore());
        assertTrue(cacheForStore.getPostings("hello world").isEmpty());

        PostingsCache cache = cacheForStore.getOrCreatePostings("hello world", List.of("hello", "world"));

        assertSame(cache, cacheForStore.getPostings("hello world").orElseThrow());
        assertSame(cache, cacheForStore.getOrCreatePostings("hello world", List.of("ignored")));
        assertArrayEquals(new int[] {1, 2}, cache.getMergedPostings("hello").toArray());
        assertArrayEquals(new int[] {2}, cache.getMergedPostings("world").toArray());
        assertTrue(cacheForStore.getPostings("other").isEmpty());
    }

    @Test
    void testNullStoreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PostingsCacheForStore(null));
    }
}
