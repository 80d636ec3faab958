package org.kos.depresolve.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.kos.depresolve.model.PackageMetadata;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the CachingMetadataProvider class
 */
public class CachingMetadataProviderTest {

    private InMemoryMetadataProvider backing;
    private AtomicInteger calls;
    private CachingMetadataProvider cache;

    @BeforeEach
    public void setUp() {
        backing = new InMemoryMetadataProvider();
        backing.register(new PackageMetadata("lib", "1.0.0", null));
        calls = new AtomicInteger();
        cache = new CachingMetadataProvider(name -> {
            calls.incrementAndGet();
            return backing.lookup(name);
        });
    }

    @Test
    public void testRepeatedLookupServedFromCache() {
        assertTrue(cache.lookup("lib").isPresent());
        assertTrue(cache.lookup("lib").isPresent());

        assertEquals(1, calls.get());
        assertEquals(1, cache.getHits());
        assertEquals(1, cache.getMisses());
        assertTrue(cache.isCached("lib"));
    }

    @Test
    public void testNegativeResultCached() {
        assertFalse(cache.lookup("ghost").isPresent());
        backing.register(new PackageMetadata("ghost", "0.1", null));

        assertFalse(cache.lookup("ghost").isPresent());
        assertEquals(1, calls.get());
    }

    @Test
    public void testInvalidate() {
        cache.lookup("lib");
        backing.register(new PackageMetadata("lib", "2.0.0", null));
        cache.invalidate("lib");

        assertFalse(cache.isCached("lib"));
        assertEquals("2.0.0", cache.lookup("lib").get().getVersion());
        assertEquals(2, calls.get());
    }

    @Test
    public void testClear() {
        cache.lookup("lib");
        cache.lookup("other");
        assertEquals(2, cache.size());

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0, cache.getMisses());
        assertEquals(0, cache.getHits());
    }

    @Test
    public void testNullDelegateRejected() {
        assertThrows(NullPointerException.class, () -> new CachingMetadataProvider(null));
    }
}
