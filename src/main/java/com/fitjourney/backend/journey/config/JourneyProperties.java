package com.fitjourney.backend.journey.config;

import com.fitjourney.backend.journey.target.PersonalizationPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.journey")
public class JourneyProperties {

    private final Targets targets = new Targets();
    private final Cache cache = new Cache();
    private final Executor executor = new Executor();

    public Targets getTargets() { return targets; }
    public Cache getCache() { return cache; }
    public Executor getExecutor() { return executor; }

    public static class Targets {

        /** live plan 什麼時候蓋過任務上的凍結值 */
        private PersonalizationPolicy personalization = PersonalizationPolicy.ALWAYS;

        /** 沒有計畫、也沒有凍結值時的預設 */
        private double defaultProteinGrams = 120;
        private double defaultDeficitCalories = 2000;
        private double defaultSurplusCalories = 2500;
        private double defaultBalancedCalories = 2200;

        public PersonalizationPolicy getPersonalization() { return personalization; }
        public void setPersonalization(PersonalizationPolicy personalization) { this.personalization = personalization; }

        public double getDefaultProteinGrams() { return defaultProteinGrams; }
        public void setDefaultProteinGrams(double defaultProteinGrams) { this.defaultProteinGrams = defaultProteinGrams; }

        public double getDefaultDeficitCalories() { return defaultDeficitCalories; }
        public void setDefaultDeficitCalories(double defaultDeficitCalories) { this.defaultDeficitCalories = defaultDeficitCalories; }

        public double getDefaultSurplusCalories() { return defaultSurplusCalories; }
        public void setDefaultSurplusCalories(double defaultSurplusCalories) { this.defaultSurplusCalories = defaultSurplusCalories; }

        public double getDefaultBalancedCalories() { return defaultBalancedCalories; }
        public void setDefaultBalancedCalories(double defaultBalancedCalories) { this.defaultBalancedCalories = defaultBalancedCalories; }
    }

    public static class Cache {

        /** 進度快取存活時間（預設 5 分鐘） */
        private Duration ttl = Duration.ofMinutes(5);

        private long maxSize = 10_000;

        public Duration getTtl() { return ttl; }
        public void setTtl(Duration ttl) { this.ttl = ttl; }

        public long getMaxSize() { return maxSize; }
        public void setMaxSize(long maxSize) { this.maxSize = maxSize; }
    }

    public static class Executor {

        private int corePoolSize = 4;
        private int maxPoolSize = 8;
        private int queueCapacity = 200;

        public int getCorePoolSize() { return corePoolSize; }
        public void setCorePoolSize(int corePoolSize) { this.corePoolSize = corePoolSize; }

        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }

        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
    }
}
