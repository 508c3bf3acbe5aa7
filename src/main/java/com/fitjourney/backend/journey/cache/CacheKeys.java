package com.fitjourney.backend.journey.cache;

/** key 格式：{domain}:{userId}[:{subId}] */
public final class CacheKeys {

    public static final String JOURNEY = "journey";
    public static final String PROGRESS = "progress";

    private CacheKeys() {}

    public static String journey(Long userId, Long stageId) {
        return JOURNEY + ":" + userId + ":" + stageId;
    }

    public static String progress(Long userId, Long taskId) {
        return PROGRESS + ":" + userId + ":" + taskId;
    }

    public static String userScope(String domain, Long userId) {
        return domain + ":" + userId;
    }
}
