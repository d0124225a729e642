package dev.zhengxiang.multiplexer;

import com.github.benmanes.caffeine.cache.Ticker;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Per-cache behaviour: how long a fetched value stays fresh, which producer errors may be
 * answered with a cached value, and the clock used for expiry.
 */
@Value
@Builder(toBuilder = true)
public class MuxConfig {

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private static final MuxConfig DEFAULTS = MuxConfig.builder().build();

    @NonNull
    @Builder.Default
    Duration timeToLive = DEFAULT_TTL;

    @NonNull
    @Builder.Default
    TransientErrorPolicy transientErrorPolicy = TransientErrorPolicy.connectivity();

    @NonNull
    @Builder.Default
    Ticker ticker = Ticker.systemTicker();

    public static MuxConfig defaults() {
        return DEFAULTS;
    }

    /**
     * @throws IllegalArgumentException if the TTL is negative
     */
    public MuxConfig validate() {
        if (timeToLive.isNegative()) {
            throw new IllegalArgumentException("TTL must not be negative: " + timeToLive);
        }
        return this;
    }

    long timeToLiveNanos() {
        return validate().timeToLive.toNanos();
    }
}
