package com.fitjourney.backend.journey.cache;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * 寫入路徑用：交易 commit 之後才清快取。
 * 先清再 commit 的話，中間有人讀會把舊資料又算回快取。
 */
@Slf4j
@Component
public class ProgressCacheInvalidator {

    private final ProgressCache cache;

    public ProgressCacheInvalidator(ProgressCache cache) {
        this.cache = cache;
    }

    public void invalidateUserAfterCommit(Long userId) {
        if (userId == null) return;

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override public void afterCommit() {
                    int n = cache.invalidateUser(userId);
                    log.debug("progress cache cleared after commit. userId={} removed={}", userId, n);
                }
            });
        } else {
            cache.invalidateUser(userId);
        }
    }
}
