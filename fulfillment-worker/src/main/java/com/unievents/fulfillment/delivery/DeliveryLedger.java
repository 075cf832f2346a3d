package com.unievents.fulfillment.delivery;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.UUID;

/**
 * Worker-side send dedup. A delivery is claimed with SET NX before sending, so a registration
 * returned by several polls is only delivered once per key.
 *
 * Keys: {@code delivery:reminder:<registrationId>:<leadMinutes>} and
 * {@code delivery:certificate:<registrationId>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeliveryLedger {

    static final String KEY_PREFIX = "delivery:";

    private final StringRedisTemplate stringRedisTemplate;

    @Value("${fulfillment.dedup-ttl-hours:72}")
    private long ttlHours = 72;

    public static String reminderKey(UUID registrationId, Duration lead) {
        return KEY_PREFIX + "reminder:" + registrationId + ":" + lead.toMinutes();
    }

    public static String certificateKey(UUID registrationId) {
        return KEY_PREFIX + "certificate:" + registrationId;
    }

    /**
     * @return true if this caller owns the delivery and should send it
     */
    public boolean claim(String key) {
        Boolean claimed = stringRedisTemplate.opsForValue()
                .setIfAbsent(key, "1", Duration.ofHours(ttlHours));
        return Boolean.TRUE.equals(claimed);
    }

    /**
     * Gives a claim back after a failed send so the next tick retries it.
     */
    public void release(String key) {
        try {
            stringRedisTemplate.delete(key);
        } catch (Exception e) {
            log.warn("Could not release delivery claim {}; it expires in {}h", key, ttlHours, e);
        }
    }
}
