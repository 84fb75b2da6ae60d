package com.phillippitts.selfconsistency.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the executor that runs reasoning samples. Reasoning work is
 * I/O bound (each task mostly waits on the model backend), so the defaults allow more threads
 * than cores.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private ReasoningPoolProperties reasoning = new ReasoningPoolProperties();

    public ReasoningPoolProperties getReasoning() {
        return reasoning;
    }

    public void setReasoning(ReasoningPoolProperties reasoning) {
        this.reasoning = reasoning;
    }

    /**
     * Reasoning executor pool configuration.
     */
    public static class ReasoningPoolProperties {
        private int corePoolSize = 8;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "reasoning-pool-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
