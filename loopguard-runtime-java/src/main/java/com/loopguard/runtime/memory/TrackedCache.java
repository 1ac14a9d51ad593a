package com.loopguard.runtime.memory;

import com.loopguard.runtime.cache.MonitoredCache;

record TrackedCache(String name, MonitoredCache cache, long maxSizeBytes) {}
