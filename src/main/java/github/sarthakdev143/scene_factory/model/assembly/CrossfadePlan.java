package github.sarthakdev143.scene_factory.model.assembly;

import java.util.List;

/**
 * Crossfade concatenation input. {@code offsetsSec.get(i)} is the start of the transition between clip i
 * and clip i + 1 on the output timeline.
 */
public record CrossfadePlan(
        List<CrossfadeClip> clips,
        double transitionSec,
        List<Double> offsetsSec,
        double expectedDurationSec,
        int width,
        int height) {

    public CrossfadePlan {
        clips = clips == null ? List.of() : List.copyOf(clips);
        offsetsSec = offsetsSec == null ? List.of() : List.copyOf(offsetsSec);
    }
}
