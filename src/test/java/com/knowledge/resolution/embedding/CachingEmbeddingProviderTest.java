package com.knowledge.resolution.embedding;

import com.knowledge.resolution.cache.CacheConfig;
import com.knowledge.resolution.cache.CacheStats;
import com.knowledge.resolution.cache.CaffeineEmbeddingCache;
import com.knowledge.resolution.cache.EmbeddingCache;
import com.knowledge.resolution.cache.NoOpEmbeddingCache;
import com.knowledge.resolution.metrics.MetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("Embedding cache Tests")
class CachingEmbeddingProviderTest {

    private EmbeddingProvider delegate;
    private EmbeddingCache cache;
    private MetricsService metrics;
    private CachingEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        delegate = mock(EmbeddingProvider.class);
        when(delegate.getProviderName()).thenReturn("model");
        when(delegate.isAvailable()).thenReturn(true);
        when(delegate.embed(anyString())).thenAnswer(inv -> new float[]{((String) inv.getArgument(0)).length()});
        when(delegate.embedBatch(anyList())).thenAnswer(inv -> {
            List<String> texts = inv.getArgument(0);
            return texts.stream().map(t -> new float[]{t.length()}).toList();
        });
        cache = new CaffeineEmbeddingCache(new CacheConfig(100, 60, true));
        metrics = mock(MetricsService.class);
        provider = new CachingEmbeddingProvider(delegate, cache, metrics);
    }

    @Nested
    @DisplayName("CachingEmbeddingProvider")
    class ProviderTests {

        @Test
        @DisplayName("Single embeds are memoised")
        void embedMemoised() {
            float[] first = provider.embed("Arsenal");
            float[] second = provider.embed("Arsenal");

            assertSame(first, second);
            verify(delegate, times(1)).embed("Arsenal");
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
        }

        @Test
        @DisplayName("Batch forwards only distinct misses and keeps input order")
        void batchForwardsMisses() {
            provider.embed("Arsenal");

            List<float[]> vectors = provider.embedBatch(List.of("Tottenham", "Arsenal", "Tottenham", "Spurs"));

            verify(delegate).embedBatch(List.of("Tottenham", "Spurs"));
            assertEquals(4, vectors.size());
            assertEquals(9f, vectors.get(0)[0]);
            assertEquals(7f, vectors.get(1)[0]);
            assertSame(vectors.get(0), vectors.get(2));
            assertEquals(5f, vectors.get(3)[0]);
        }

        @Test
        @DisplayName("Fully cached batch makes no delegate call")
        void fullyCached() {
            provider.embedBatch(List.of("Arsenal", "Spurs"));
            provider.embedBatch(List.of("Spurs", "Arsenal"));

            verify(delegate, times(1)).embedBatch(anyList());
        }

        @Test
        @DisplayName("Delegate returning too few vectors is an EmbeddingException")
        void shortBatch() {
            when(delegate.embedBatch(anyList())).thenReturn(List.of());

            assertThrows(EmbeddingException.class, () -> provider.embedBatch(List.of("Arsenal")));
        }

        @Test
        @DisplayName("Name and availability come from the delegate")
        void delegation() {
            assertEquals("Caching(model)", provider.getProviderName());
            assertTrue(provider.isAvailable());
        }
    }

    @Nested
    @DisplayName("EmbeddingCache implementations")
    class CacheImplementationTests {

        @Test
        @DisplayName("Caffeine cache tracks hits and misses")
        void caffeineStats() {
            cache.put("Arsenal", new float[]{1f});
            cache.get("Arsenal");
            cache.get("Chelsea");

            CacheStats stats = cache.getStats();
            assertEquals(1, stats.hitCount());
            assertEquals(1, stats.missCount());
            assertEquals(2, stats.requestCount());
            assertEquals(0.5, stats.hitRate());
        }

        @Test
        @DisplayName("Null keys and values are ignored")
        void nullsIgnored() {
            cache.put(null, new float[]{1f});
            cache.put("Arsenal", null);

            assertTrue(cache.get(null).isEmpty());
            assertTrue(cache.get("Arsenal").isEmpty());
        }

        @Test
        @DisplayName("invalidateAll empties the cache")
        void invalidateAll() {
            cache.put("Arsenal", new float[]{1f});
            cache.invalidateAll();

            assertTrue(cache.get("Arsenal").isEmpty());
        }

        @Test
        @DisplayName("create() honours the enabled flag")
        void factory() {
            assertInstanceOf(CaffeineEmbeddingCache.class, CaffeineEmbeddingCache.create(CacheConfig.defaults()));
            assertInstanceOf(NoOpEmbeddingCache.class, CaffeineEmbeddingCache.create(CacheConfig.disabled()));
        }

        @Test
        @DisplayName("No-op cache stores nothing")
        void noOp() {
            NoOpEmbeddingCache noOp = new NoOpEmbeddingCache();
            noOp.put("Arsenal", new float[]{1f});

            assertTrue(noOp.get("Arsenal").isEmpty());
            assertEquals(CacheStats.empty(), noOp.getStats());
        }

        @Test
        @DisplayName("CacheConfig rejects non-positive sizes")
        void configValidation() {
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(0, 60, true));
            assertThrows(IllegalArgumentException.class, () -> new CacheConfig(10, 0, true));
        }
    }
}
