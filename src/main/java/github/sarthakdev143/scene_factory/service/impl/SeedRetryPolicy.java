package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.model.SeedSource;

import java.time.Duration;
import java.util.List;

/**
 * Decides what follows a seed transfer failure for one scene.
 * <p>
 * A continuity seed switches once, without waiting, to the scene's static image when one exists. Any
 * other seed is retried as-is after the backoff for the attempt that just failed, so a retry after the
 * switch waits the second backoff step. Every attempt, including the switch, counts towards
 * {@link #MAX_ATTEMPTS}.
 */
public final class SeedRetryPolicy {

    public static final int MAX_ATTEMPTS = 3;

    private final List<Duration> backoff;

    public SeedRetryPolicy(List<Duration> backoff) {
        this.backoff = backoff == null ? List.of() : List.copyOf(backoff);
    }

    /**
     * @param failedSource      seed used by the attempt that just failed
     * @param attemptsMade      attempts made so far, including the failed one
     * @param staticSeedAvailable whether the scene has a registered static image
     */
    public Decision onSeedFailure(
            SeedSource failedSource,
            int attemptsMade,
            boolean staticSeedAvailable) {
        if (attemptsMade >= MAX_ATTEMPTS) {
            return Decision.giveUp();
        }
        if (failedSource == SeedSource.CONTINUITY_FRAME && staticSeedAvailable) {
            return Decision.switchToStatic();
        }
        if (backoff.isEmpty()) {
            return Decision.retryAfter(Duration.ZERO);
        }
        int index = Math.min(Math.max(attemptsMade - 1, 0), backoff.size() - 1);
        return Decision.retryAfter(backoff.get(index));
    }

    public enum Action {
        SWITCH_TO_STATIC,
        RETRY_SAME_SEED,
        GIVE_UP
    }

    public record Decision(Action action, Duration delay) {

        static Decision switchToStatic() {
            return new Decision(Action.SWITCH_TO_STATIC, Duration.ZERO);
        }

        static Decision retryAfter(Duration delay) {
            return new Decision(Action.RETRY_SAME_SEED, delay);
        }

        static Decision giveUp() {
            return new Decision(Action.GIVE_UP, Duration.ZERO);
        }
    }
}
