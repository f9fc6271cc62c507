package lichess.client.http;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.http.HttpHeaders;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the Retry-After header of a 429 response into a wait duration.
 * <p>
 * Both forms of the header are understood: delta seconds ({@code Retry-After: 60}) and an HTTP date
 * ({@code Retry-After: Wed, 21 Oct 2026 07:28:00 GMT}). A missing or unreadable header yields the fallback.
 */
public final class RateLimitSignalExtractor {
    static final String RETRY_AFTER = "Retry-After";

    /**
     * The longest wait a signal carries, about 292 years; longer announcements are cut to it.
     */
    public static final Duration MAX_WAIT = Duration.ofNanos(Long.MAX_VALUE);
    private static final BigDecimal MAX_WAIT_MILLIS = BigDecimal.valueOf(MAX_WAIT.toMillis());

    private final Duration fallback;
    private final Clock clock;

    public RateLimitSignalExtractor(Duration fallback, Clock clock) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RateLimitSignal extract(HttpHeaders headers) {
        Optional<String> header = headers.firstValue(RETRY_AFTER);
        if (header.isEmpty() || header.get().isBlank()) {
            return new RateLimitSignal(fallback, false);
        }
        Duration parsed = parse(header.get().trim());
        return parsed == null ? new RateLimitSignal(fallback, false) : new RateLimitSignal(parsed, true);
    }

    private Duration parse(String value) {
        if (Character.isDigit(value.charAt(0))) {
            try {
                BigDecimal millis = new BigDecimal(value).movePointRight(3).setScale(0, RoundingMode.CEILING);
                return millis.compareTo(MAX_WAIT_MILLIS) > 0 ? MAX_WAIT : Duration.ofMillis(millis.longValueExact());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            Instant until = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME).toInstant();
            Duration remaining = Duration.between(clock.instant(), until);
            if (remaining.isNegative()) {
                return Duration.ZERO;
            }
            return remaining.compareTo(MAX_WAIT) > 0 ? MAX_WAIT : remaining;
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
