package io.github.drompincen.aegis.runtime.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.UUID;

/**
 * Tuning for the human-approval wait.
 *
 * @param pollInterval how often a waiting caller re-reads the request
 * @param timeout      deadline after which a BOUNDED wait auto-denies the request
 * @param waitMode     BOUNDED (default, fail-closed) or UNBOUNDED (poll until a human decides)
 * @param replayWindow how long a human decision keeps answering later calls of the
 *                     same action; zero asks a human every time
 * @param sessionId    stamped on every request this process opens; decisions are only
 *                     replayed within one session. A random id is used when unset, so a
 *                     restart starts from a clean slate.
 */
@ConfigurationProperties(prefix = "aegis.approval")
public record ApprovalProperties(
        @DefaultValue("PT1S") Duration pollInterval,
        @DefaultValue("PT5M") Duration timeout,
        @DefaultValue("BOUNDED") WaitMode waitMode,
        @DefaultValue("PT15M") Duration replayWindow,
        String sessionId
) {
    public enum WaitMode {
        BOUNDED,
        UNBOUNDED
    }

    public ApprovalProperties {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("aegis.approval.poll-interval must be positive");
        }
        if (waitMode == WaitMode.BOUNDED && (timeout == null || timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("aegis.approval.timeout must be positive in BOUNDED mode");
        }
        if (replayWindow == null) {
            replayWindow = Duration.ZERO;
        } else if (replayWindow.isNegative()) {
            throw new IllegalArgumentException("aegis.approval.replay-window must not be negative");
        }
        if (sessionId == null || sessionId.isBlank()) {
            sessionId = UUID.randomUUID().toString();
        }
    }

    public boolean bounded() {
        return waitMode == WaitMode.BOUNDED;
    }

    public static ApprovalProperties defaults() {
        return new ApprovalProperties(Duration.ofSeconds(1), Duration.ofMinutes(5), WaitMode.BOUNDED,
                Duration.ofMinutes(15), null);
    }
}
