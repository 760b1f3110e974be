package com.defiguard.governance;

import com.defiguard.tool.ToolCallContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stage 4: minimum spacing between successful capital-committing calls, either globally
 * or per input/output pair.
 *
 * <p>Only one capital-committing call per cooldown key may be in flight: {@link #decide}
 * claims the key's slot, {@link #record} stamps the success time and frees it,
 * {@link #release} just frees it. A failed or abandoned call leaves the last-success
 * timestamp alone.
 */
public class CooldownGate implements ToolCallInterceptor {

    private static final Logger log = LoggerFactory.getLogger(CooldownGate.class);

    static final String COOLDOWN_ACTIVE = "COOLDOWN_ACTIVE";
    static final String GLOBAL_KEY = "*";

    private final Duration cooldown;
    private final boolean perSymbol;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Instant> lastSuccess = new HashMap<>();
    /** cooldown key -> call id holding the slot */
    private final Map<String, String> inFlight = new HashMap<>();
    /** call id -> cooldown key */
    private final Map<String, String> slotsByCall = new HashMap<>();

    public CooldownGate(Duration cooldown, boolean perSymbol, Clock clock) {
        this.cooldown = cooldown;
        this.perSymbol = perSymbol;
        this.clock = clock;
    }

    @Override
    public GovernanceStage stage() {
        return GovernanceStage.COOLDOWN;
    }

    @Override
    public InterceptorDecision decide(ToolCallContext context) {
        if (!context.isCapitalCommitting() || cooldown.isZero()) {
            return InterceptorDecision.allow();
        }
        String key = keyFor(context);

        lock.lock();
        try {
            String holder = inFlight.get(key);
            if (holder != null && !holder.equals(context.getCallId())) {
                return InterceptorDecision.limitExceeded(
                        COOLDOWN_ACTIVE,
                        "Trading cooldown active. Another capital-committing call is still in flight.",
                        Map.of("limit", "cooldown", "key", key, "in_flight", true));
            }

            Instant last = lastSuccess.get(key);
            if (last != null) {
                Duration elapsed = Duration.between(last, clock.instant());
                if (elapsed.compareTo(cooldown) < 0) {
                    long remainingSeconds = remainingSeconds(cooldown.minus(elapsed));
                    return InterceptorDecision.limitExceeded(
                            COOLDOWN_ACTIVE,
                            "Trading cooldown active. Please wait " + remainingSeconds + " more seconds.",
                            details(key, remainingSeconds));
                }
            }

            inFlight.put(key, context.getCallId());
            slotsByCall.put(context.getCallId(), key);
            return InterceptorDecision.allow();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void record(ToolCallContext context) {
        lock.lock();
        try {
            String key = slotsByCall.remove(context.getCallId());
            if (key == null) {
                return;
            }
            inFlight.remove(key);
            Instant now = clock.instant();
            lastSuccess.put(key, now);
            log.debug("Cooldown started [key={}, callId={}, until={}]", key, context.getCallId(), now.plus(cooldown));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void release(ToolCallContext context) {
        lock.lock();
        try {
            String key = slotsByCall.remove(context.getCallId());
            if (key != null) {
                inFlight.remove(key);
            }
        } finally {
            lock.unlock();
        }
    }

    private String keyFor(ToolCallContext context) {
        if (!perSymbol || context.getSymbol() == null) {
            return GLOBAL_KEY;
        }
        return context.getSymbol();
    }

    /** Rounded up so "wait 0 seconds" is never reported while still blocked. */
    private static long remainingSeconds(Duration remaining) {
        long seconds = remaining.getSeconds();
        return remaining.getNano() > 0 ? seconds + 1 : seconds;
    }

    private static Map<String, Object> details(String key, long remainingSeconds) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", "cooldown");
        details.put("key", key);
        details.put("remaining_seconds", remainingSeconds);
        return details;
    }
}
