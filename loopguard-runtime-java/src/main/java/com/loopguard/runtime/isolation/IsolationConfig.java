package com.loopguard.runtime.isolation;

import com.loopguard.runtime.GuardConfigurationException;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Request isolation settings.
 */
public final class IsolationConfig {

    public static final Set<String> DEFAULT_SERVER_ALLOW_LIST = Set.copyOf(List.of(
        "SERVER_NAME", "SERVER_ADDR", "SERVER_PORT", "SERVER_SOFTWARE", "SERVER_PROTOCOL",
        "GATEWAY_INTERFACE", "DOCUMENT_ROOT", "SCRIPT_NAME", "SCRIPT_FILENAME",
        "REQUEST_TIME", "REQUEST_TIME_FLOAT"));

    public static final Set<String> DEFAULT_ENVIRONMENT_ALLOW_LIST = Set.of(
        "PATH", "HOME", "USER", "LANG", "LC_ALL", "TZ");

    private final Duration maxContextDuration;
    private final long maxMemoryGrowthBytes;
    private final Set<String> serverAllowList;
    private final Set<String> environmentAllowList;
    private final boolean collectOnDestroy;
    private final Duration leakSweepInterval;

    private IsolationConfig(Builder b) {
        this.maxContextDuration = b.maxContextDuration;
        this.maxMemoryGrowthBytes = b.maxMemoryGrowthBytes;
        this.serverAllowList = Set.copyOf(b.serverAllowList);
        this.environmentAllowList = Set.copyOf(b.environmentAllowList);
        this.collectOnDestroy = b.collectOnDestroy;
        this.leakSweepInterval = b.leakSweepInterval;
    }

    public static IsolationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Duration maxContextDuration()      { return maxContextDuration; }
    /** Memory growth above which a context counts as leaked; 0 disables the check. */
    public long maxMemoryGrowthBytes()        { return maxMemoryGrowthBytes; }
    public Set<String> serverAllowList()      { return serverAllowList; }
    public Set<String> environmentAllowList() { return environmentAllowList; }
    public boolean collectOnDestroy()         { return collectOnDestroy; }
    public Duration leakSweepInterval()       { return leakSweepInterval; }

    public static final class Builder {

        private Duration maxContextDuration = Duration.ofSeconds(30);
        private long maxMemoryGrowthBytes = 0;
        private Set<String> serverAllowList = new LinkedHashSet<>(DEFAULT_SERVER_ALLOW_LIST);
        private Set<String> environmentAllowList = new LinkedHashSet<>(DEFAULT_ENVIRONMENT_ALLOW_LIST);
        private boolean collectOnDestroy = true;
        private Duration leakSweepInterval = Duration.ofSeconds(10);

        private Builder() {}

        public Builder maxContextDuration(Duration v)     { this.maxContextDuration = v; return this; }
        public Builder maxMemoryGrowthBytes(long v)       { this.maxMemoryGrowthBytes = v; return this; }
        public Builder serverAllowList(Set<String> v)     { this.serverAllowList = new LinkedHashSet<>(v); return this; }
        public Builder environmentAllowList(Set<String> v) { this.environmentAllowList = new LinkedHashSet<>(v); return this; }
        public Builder collectOnDestroy(boolean v)        { this.collectOnDestroy = v; return this; }
        public Builder leakSweepInterval(Duration v)      { this.leakSweepInterval = v; return this; }

        public IsolationConfig build() {
            if (maxContextDuration == null || maxContextDuration.isZero() || maxContextDuration.isNegative()) {
                throw new GuardConfigurationException("maxContextDuration must be positive: " + maxContextDuration);
            }
            if (leakSweepInterval == null || leakSweepInterval.isZero() || leakSweepInterval.isNegative()) {
                throw new GuardConfigurationException("leakSweepInterval must be positive: " + leakSweepInterval);
            }
            if (maxMemoryGrowthBytes < 0) {
                throw new GuardConfigurationException("maxMemoryGrowthBytes must not be negative: " + maxMemoryGrowthBytes);
            }
            return new IsolationConfig(this);
        }
    }
}
