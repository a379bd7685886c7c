package com.partnerlink.processing;

import static org.assertj.core.api.Assertions.*;

import com.partnerlink.model.ConfidenceBand;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

class CachingParentCompanyResolverTest {

    private final AtomicInteger calls = new AtomicInteger();
    private InMemoryResolutionCache cache;

    @BeforeEach
    void setUp() {
        cache = new InMemoryResolutionCache();
    }

    private ParentCompanyResolver countingResolver(ParentCompanyResult result) {
        return name -> {
            calls.incrementAndGet();
            return result;
        };
    }

    @Test
    void testResolvedResultIsCached() {
        ParentCompanyResult toysRUs = ParentCompanyResult.resolved("トイザラス熊本店", "日本トイザらス株式会社",
                ConfidenceBand.HIGH, "retail chain");
        CachingParentCompanyResolver resolver = new CachingParentCompanyResolver(countingResolver(toysRUs), cache);

        assertThat(resolver.resolve("トイザラス熊本店")).isEqualTo(toysRUs);
        assertThat(resolver.resolve("トイザラス熊本店")).isEqualTo(toysRUs);

        assertThat(calls).hasValue(1);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void testUnresolvedResultIsNotCached() {
        CachingParentCompanyResolver resolver = new CachingParentCompanyResolver(
                countingResolver(ParentCompanyResult.unresolved("山田商店", "individual")), cache);

        resolver.resolve("山田商店");
        resolver.resolve("山田商店");

        assertThat(calls).hasValue(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void testDelegateFailurePropagatesAndCachesNothing() {
        CachingParentCompanyResolver resolver = new CachingParentCompanyResolver(name -> {
            throw new IllegalStateException("lookup service unavailable");
        }, cache);

        assertThatThrownBy(() -> resolver.resolve("ローソン"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("lookup service unavailable");
        assertThat(cache.get("ローソン")).isEmpty();
    }

    @Test
    void testInvalidateAll() {
        cache.put("a", ParentCompanyResult.resolved("a", "A", ConfidenceBand.LOW, ""));
        cache.put("b", ParentCompanyResult.resolved("b", "B", ConfidenceBand.LOW, ""));

        assertThat(cache.invalidateAll()).isEqualTo(2);
        assertThat(cache.size()).isZero();
        assertThat(cache.get(null)).isEmpty();
    }

    @Test
    void testBlankParentCompanyIsNotResolved() {
        ParentCompanyResult blank = new ParentCompanyResult("x", java.util.Optional.of(" "),
                ConfidenceBand.LOW, null, false, null);

        assertThat(blank.isResolved()).isFalse();
        assertThat(blank.reasoning()).isEmpty();
    }
}
