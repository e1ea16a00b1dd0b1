package com.alpharadar.alert;

import com.alpharadar.alert.config.AlertProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Per-contract alert suppression. A contract is on cooldown while less than the cooldown period has passed
 * since its last recorded alert. State is process-local and lost on restart.
 * All access goes through one monitor.
 */
@Component
@Slf4j
public class CooldownGate {

    private final Map<String, Instant> lastAlertAt = new HashMap<>();
    private final Clock clock;
    private final Duration cooldown;

    public CooldownGate(AlertProperties properties, Clock clock) {
        if (properties.getCooldownMinutes() <= 0) {
            throw new IllegalArgumentException("cooldown-minutes must be positive: " + properties.getCooldownMinutes());
        }
        this.clock = clock;
        this.cooldown = Duration.ofMinutes(properties.getCooldownMinutes());
    }

    public synchronized boolean isOnCooldown(String contract) {
        Instant last = lastAlertAt.get(contract);
        if (last == null) {
            return false;
        }
        return Duration.between(last, clock.instant()).compareTo(cooldown) < 0;
    }

    /** Call only after a delivery attempt that did not fail. */
    public synchronized void recordAlert(String contract) {
        lastAlertAt.put(contract, clock.instant());
    }

    /**
     * Drops entries whose age is at least the cooldown, the same boundary at which
     * {@link #isOnCooldown(String)} turns false.
     *
     * @return number of entries removed
     */
    public synchronized int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        Iterator<Map.Entry<String, Instant>> it = lastAlertAt.entrySet().iterator();
        while (it.hasNext()) {
            if (Duration.between(it.next().getValue(), now).compareTo(cooldown) >= 0) {
                it.remove();
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired cooldowns, {} active", removed, lastAlertAt.size());
        }
        return removed;
    }

    public synchronized int activeCount() {
        return lastAlertAt.size();
    }

    public Duration getCooldown() {
        return cooldown;
    }
}
