package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.model.SceneDescription;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a free-form scene script into scene descriptions.
 * <p>
 * Each scene starts with a header such as {@code **SCENE 1: HOOK (7 seconds)**} followed by labelled
 * fields ({@code Visual Description:}, {@code Camera/Movement:}, {@code Lighting & Mood:} and the audio
 * bullets). The duration in the header is optional. Sections without a usable visual description are
 * skipped.
 */
public final class SceneScriptParser {

    static final String DEFAULT_CAMERA_WORK = "Smooth, steady cinematic camera movement";
    static final String DEFAULT_LIGHTING = "Natural, balanced lighting with a professional look";
    private static final int FALLBACK_DURATION_SECONDS = 7;
    private static final int MAX_SCENE_DURATION_SECONDS = 60;
    private static final Map<String, Integer> DEFAULT_DURATIONS = Map.of(
            "hook", 7,
            "problem", 7,
            "solution", 10,
            "cta", 6);

    private static final Pattern SCENE_HEADER = Pattern.compile(
            "\\*\\*\\s*SCENE\\s+(\\d+)\\s*:\\s*([^*(\\n]+?)\\s*(?:\\((\\d+)\\s*seconds?[^)]*\\))?\\s*\\*\\*",
            Pattern.CASE_INSENSITIVE);
    private static final String FIELD_STOP =
            "(?=\\n\\s*[-*]*\\s*\\**\\s*(?:Visual\\s+Description|Camera/Movement|Camera|Lighting\\s*&\\s*Mood|"
                    + "Image\\s+Integration|Audio\\s+Design|Background\\s+Music|Sound\\s+Effects|Dialog/Narration|"
                    + "Audio\\s+Balance|Engagement\\s+Target|Emotional\\s+Tone)\\s*\\**\\s*:|\\z)";
    private static final Pattern VISUAL = field("Visual\\s+Description");
    private static final Pattern CAMERA = field("Camera(?:/Movement)?");
    private static final Pattern LIGHTING = field("Lighting\\s*&\\s*Mood");
    private static final Pattern AUDIO_DESIGN = field("Audio\\s+Design");
    private static final Pattern MUSIC = field("Background\\s+Music");
    private static final Pattern SOUND_EFFECTS = field("Sound\\s+Effects");
    private static final Pattern DIALOG = field("Dialog/Narration");

    private SceneScriptParser() {
    }

    public static List<SceneDescription> parse(String script) {
        if (script == null || script.isBlank()) {
            return List.of();
        }

        List<MatchResult> headers = new ArrayList<>();
        Matcher header = SCENE_HEADER.matcher(script);
        while (header.find()) {
            headers.add(header.toMatchResult());
        }

        List<SceneDescription> scenes = new ArrayList<>();
        for (int index = 0; index < headers.size(); index++) {
            MatchResult current = headers.get(index);
            int bodyEnd = index + 1 < headers.size() ? headers.get(index + 1).start() : script.length();
            String body = script.substring(current.end(), bodyEnd);

            String visual = extract(VISUAL, body);
            if (visual == null) {
                continue;
            }
            String scenario = toScenario(current.group(2));
            if (scenario.isEmpty()) {
                continue;
            }
            int duration = resolveDuration(current.group(3), scenario);
            String camera = extract(CAMERA, body);
            String lighting = extract(LIGHTING, body);
            scenes.add(new SceneDescription(
                    scenario,
                    duration,
                    visual,
                    camera != null ? camera : DEFAULT_CAMERA_WORK,
                    lighting != null ? lighting : DEFAULT_LIGHTING,
                    extract(AUDIO_DESIGN, body),
                    extract(MUSIC, body),
                    extract(SOUND_EFFECTS, body),
                    extract(DIALOG, body)));
        }
        return scenes;
    }

    private static Pattern field(String label) {
        return Pattern.compile(
                "(?:^|\\n)\\s*[-*]*\\s*\\**\\s*" + label + "[ \\t]*\\**[ \\t]*:[ \\t]*\\**[ \\t]*(.*?)" + FIELD_STOP,
                Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    private static String extract(Pattern pattern, String body) {
        Matcher matcher = pattern.matcher(body);
        if (!matcher.find()) {
            return null;
        }
        String value = matcher.group(1).replaceAll("\\s+", " ").trim();
        return value.isEmpty() ? null : value;
    }

    private static String toScenario(String name) {
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith("call-to-action") || normalized.startsWith("call to action")) {
            return "cta";
        }
        return normalized.replaceAll("[^a-z0-9]+", "_").replaceAll("^_+|_+$", "");
    }

    private static int resolveDuration(String declared, String scenario) {
        if (declared != null) {
            try {
                int parsed = Integer.parseInt(declared);
                if (parsed > 0 && parsed <= MAX_SCENE_DURATION_SECONDS) {
                    return parsed;
                }
            } catch (NumberFormatException ignored) {
                // Fall through to the scenario default.
            }
        }
        return DEFAULT_DURATIONS.getOrDefault(scenario, FALLBACK_DURATION_SECONDS);
    }
}
