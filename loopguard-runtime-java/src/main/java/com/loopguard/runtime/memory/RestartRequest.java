package com.loopguard.runtime.memory;

import java.time.Instant;

/**
 * Signal for an external supervisor that the process should be restarted gracefully.
 */
public record RestartRequest(long currentBytes, long thresholdBytes, Instant requestedAt) {}
