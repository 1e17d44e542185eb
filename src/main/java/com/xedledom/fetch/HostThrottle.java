package com.xedledom.fetch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-host gate shared by every request of a run: keeps a minimum spacing between
 * request starts and holds all requests to a host while a rate-limit cooldown runs.
 */
public final class HostThrottle {

    private final Duration minInterval;
    private final Duration cooldown;
    private final Clock clock;
    private final Sleeper sleeper;
    private final Map<String, HostState> hosts = new ConcurrentHashMap<>();

    public HostThrottle(Duration minInterval, Duration cooldown, Clock clock, Sleeper sleeper) {
        this.minInterval = minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval;
        this.cooldown = cooldown == null || cooldown.isNegative() ? Duration.ZERO : cooldown;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public HostThrottle(Duration minInterval, Duration cooldown) {
        this(minInterval, cooldown, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    public Duration getCooldown() {
        return cooldown;
    }

    /**
     * Blocks until the host is out of cooldown and its spacing slot is free, then claims the slot.
     */
    public void awaitTurn(String host) throws InterruptedException {
        HostState state = hosts.computeIfAbsent(key(host), k -> new HostState());
        while (true) {
            Duration wait = state.tryClaim(clock.instant(), minInterval);
            if (wait.isZero()) {
                return;
            }
            sleeper.sleep(wait);
        }
    }

    /**
     * Starts (or extends) the cooldown window for a host.
     */
    public void tripCooldown(String host) {
        HostState state = hosts.computeIfAbsent(key(host), k -> new HostState());
        state.extendCooldown(clock.instant().plus(cooldown));
    }

    public boolean isCoolingDown(String host) {
        HostState state = hosts.get(key(host));
        return state != null && state.coolingDownAt(clock.instant());
    }

    private static String key(String host) {
        return host == null ? "" : host.toLowerCase();
    }

    private static final class HostState {
        private Instant nextAllowed = Instant.MIN;
        private Instant cooldownUntil = Instant.MIN;

        private synchronized Duration tryClaim(Instant now, Duration minInterval) {
            Instant readyAt = nextAllowed.isAfter(cooldownUntil) ? nextAllowed : cooldownUntil;
            if (readyAt.isAfter(now)) {
                return Duration.between(now, readyAt);
            }
            nextAllowed = now.plus(minInterval);
            return Duration.ZERO;
        }

        private synchronized void extendCooldown(Instant until) {
            if (until.isAfter(cooldownUntil)) {
                cooldownUntil = until;
            }
        }

        private synchronized boolean coolingDownAt(Instant now) {
            return cooldownUntil.isAfter(now);
        }
    }
}
