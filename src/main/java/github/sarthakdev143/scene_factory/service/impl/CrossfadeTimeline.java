package github.sarthakdev143.scene_factory.service.impl;

import java.util.ArrayList;
import java.util.List;

/**
 * Transition offsets for chained crossfades. Each transition overlaps the tail of the output so far
 * with the head of the next clip, so {@code offset_i = d_0 + ... + d_i - (i + 1) * t} and the total is
 * {@code sum(d) - (n - 1) * t}.
 */
public final class CrossfadeTimeline {

    private final List<Double> durations;
    private final double transitionSeconds;

    private CrossfadeTimeline(List<Double> durations, double transitionSeconds) {
        this.durations = durations;
        this.transitionSeconds = transitionSeconds;
    }

    /**
     * Builds a timeline with the requested transition clamped to half of the shortest clip.
     */
    public static CrossfadeTimeline of(List<Double> clipDurations, double requestedTransitionSeconds) {
        if (clipDurations == null || clipDurations.isEmpty()) {
            throw new IllegalArgumentException("At least one clip duration is required.");
        }
        double shortest = Double.MAX_VALUE;
        for (Double duration : clipDurations) {
            if (duration == null || duration <= 0) {
                throw new IllegalArgumentException("Clip durations must be positive.");
            }
            shortest = Math.min(shortest, duration);
        }
        double transition = Math.min(Math.max(requestedTransitionSeconds, 0.0), shortest / 2.0);
        return new CrossfadeTimeline(List.copyOf(clipDurations), transition);
    }

    public double transitionSeconds() {
        return transitionSeconds;
    }

    public List<Double> offsets() {
        List<Double> offsets = new ArrayList<>(durations.size() - 1);
        double cumulative = 0.0;
        for (int index = 0; index < durations.size() - 1; index++) {
            cumulative += durations.get(index);
            offsets.add(cumulative - (index + 1) * transitionSeconds);
        }
        return offsets;
    }

    public double totalDurationSeconds() {
        double sum = 0.0;
        for (Double duration : durations) {
            sum += duration;
        }
        return sum - (durations.size() - 1) * transitionSeconds;
    }
}
