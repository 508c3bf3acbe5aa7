package com.fitjourney.backend.journey.cache;

import com.fitjourney.backend.journey.config.JourneyProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * 進度快取（process 內，Caffeine）。
 *
 * <p>過期是寫入後 TTL（預設 5 分鐘），讀的時候才判斷。
 * 快取本身不知道任何寫入路徑：記餐、量體重、改計畫的 service 要自己呼叫
 * {@link #invalidatePattern(String)} / {@link #invalidateUser(Long)}。</p>
 */
@Slf4j
@Component
public class ProgressCache {

    private final Cache<String, Object> cache;

    @Autowired
    public ProgressCache(JourneyProperties props) {
        this(props.getCache().getTtl(), props.getCache().getMaxSize(), Ticker.systemTicker());
    }

    public ProgressCache(Duration ttl, long maxSize, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maxSize)
                .ticker(ticker)
                .build();
    }

    public <T> Optional<T> get(String key, Class<T> type) {
        Object v = cache.getIfPresent(key);
        return type.isInstance(v) ? Optional.of(type.cast(v)) : Optional.empty();
    }

    public void set(String key, Object value) {
        if (key == null || value == null) return;
        cache.put(key, value);
    }

    public void invalidate(String key) {
        if (key == null) return;
        cache.invalidate(key);
    }

    /** 移除所有以 prefix 開頭的 key，回傳移除數量 */
    public int invalidatePattern(String prefix) {
        if (prefix == null || prefix.isEmpty()) return 0;
        List<String> keys = cache.asMap().keySet().stream()
                .filter(k -> k.startsWith(prefix))
                .toList();
        cache.invalidateAll(keys);
        log.debug("progress cache invalidated. prefix={} removed={}", prefix, keys.size());
        return keys.size();
    }

    /**
     * 某個使用者的 journey / progress 全部清掉。
     * 用 "domain:uid:" 當 prefix，userId=1 才不會誤刪 userId=10 的 key。
     */
    public int invalidateUser(Long userId) {
        if (userId == null) return 0;
        int removed = 0;
        for (String domain : List.of(CacheKeys.JOURNEY, CacheKeys.PROGRESS)) {
            String scope = CacheKeys.userScope(domain, userId);
            if (cache.asMap().remove(scope) != null) removed++;
            removed += invalidatePattern(scope + ":");
        }
        return removed;
    }

    public void clear() {
        cache.invalidateAll();
    }

    long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }
}
