package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.TreeSet;

/**
 * Maps a requested clip duration onto the set of durations the video model accepts. A requested value
 * that is not accepted rounds up to the nearest accepted value, capped at the largest one. An empty
 * accepted set passes every positive duration through unchanged.
 */
@Component
public class VideoDurationPolicy {

    private final TreeSet<Integer> acceptedDurations;

    @Autowired
    public VideoDurationPolicy(SceneFactoryProperties properties) {
        this(properties.generation().acceptedVideoDurations());
    }

    VideoDurationPolicy(List<Integer> acceptedDurations) {
        this.acceptedDurations = new TreeSet<>();
        for (Integer duration : acceptedDurations) {
            if (duration != null && duration > 0) {
                this.acceptedDurations.add(duration);
            }
        }
    }

    public int apply(int requestedSeconds) {
        if (requestedSeconds <= 0) {
            throw new IllegalArgumentException("Requested duration must be positive.");
        }
        if (acceptedDurations.isEmpty() || acceptedDurations.contains(requestedSeconds)) {
            return requestedSeconds;
        }
        Integer ceiling = acceptedDurations.ceiling(requestedSeconds);
        return ceiling != null ? ceiling : acceptedDurations.last();
    }

    public boolean isAdjusted(int requestedSeconds) {
        return apply(requestedSeconds) != requestedSeconds;
    }
}
