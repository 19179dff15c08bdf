package com.conversio.service.core.funnel.breakdown;

import com.conversio.funnel.model.FunnelQuery;
import com.conversio.service.core.config.FunnelProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Remembers discovered breakdown domains per query hash for as long as its owner keeps it. Callers share one memo
 * across the requests that should see the same domain and invalidate it when the underlying events change. A
 * failed discovery is never stored.
 */
@Slf4j
public class BreakdownValueMemo {

    private final Cache<String, BreakdownDomain> domains;

    public BreakdownValueMemo(int cacheSize, Duration ttl) {
        domains = Caffeine.newBuilder()
                .maximumSize(cacheSize)
                .expireAfterWrite(ttl)
                .recordStats()
                .build();
        log.debug("Initialized breakdown value memo size={} ttl={}.", cacheSize, ttl);
    }

    public static BreakdownValueMemo from(FunnelProperties properties) {
        FunnelProperties.Memo memo = properties.getBreakdown().getMemo();
        return new BreakdownValueMemo(memo.getCacheSize(), memo.getTtl());
    }

    public BreakdownDomain getOrDiscover(FunnelQuery query, Supplier<BreakdownDomain> discovery) {
        String key = FunnelSpecHasher.hash(query);
        return domains.get(key, ignored -> {
            BreakdownDomain domain = discovery.get();
            log.debug("Discovered {} breakdown values for query {}", domain.values().size(), key);
            return domain;
        });
    }

    public void invalidate(FunnelQuery query) {
        domains.invalidate(FunnelSpecHasher.hash(query));
    }

    public void invalidateAll() {
        domains.invalidateAll();
    }

    public long size() {
        domains.cleanUp();
        return domains.estimatedSize();
    }
}
