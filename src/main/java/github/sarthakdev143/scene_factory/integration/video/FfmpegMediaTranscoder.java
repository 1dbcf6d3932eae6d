package github.sarthakdev143.scene_factory.integration.video;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import github.sarthakdev143.scene_factory.exception.AssemblyException;
import github.sarthakdev143.scene_factory.model.MediaProbe;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadeClip;
import github.sarthakdev143.scene_factory.model.assembly.CrossfadePlan;
import github.sarthakdev143.scene_factory.service.MediaTranscoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegMediaTranscoder implements MediaTranscoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegMediaTranscoder.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final String DEFAULT_FFPROBE_BINARY = "ffprobe";
    private static final double LAST_FRAME_OFFSET_SECONDS = 0.1;
    private static final int OUTPUT_FRAME_RATE = 30;
    private static final int AUDIO_SAMPLE_RATE = 44100;

    private final SceneFactoryProperties.Assembly assemblyProperties;
    private final ObjectMapper objectMapper;

    public FfmpegMediaTranscoder(SceneFactoryProperties properties, ObjectMapper objectMapper) {
        this.assemblyProperties = properties.assembly();
        this.objectMapper = objectMapper;
    }

    @Override
    public MediaProbe probe(Path mediaPath) throws AssemblyException, InterruptedException {
        String output = runCommand(buildProbeCommand(mediaPath), "probe " + mediaPath.getFileName());
        return parseProbeOutput(output, mediaPath);
    }

    @Override
    public Path extractLastFrame(Path videoPath, Path framePath) throws AssemblyException, InterruptedException {
        MediaProbe probe = probe(videoPath);
        double seekSeconds = Math.max(0.0, probe.durationSeconds() - LAST_FRAME_OFFSET_SECONDS);
        runCommand(buildExtractLastFrameCommand(videoPath, seekSeconds, framePath), "extract last frame");
        if (!Files.isRegularFile(framePath)) {
            throw new AssemblyException("FFmpeg produced no frame for " + videoPath);
        }
        return framePath;
    }

    @Override
    public Path merge(Path videoPath, Path audioPath, Path outputPath) throws AssemblyException, InterruptedException {
        runCommand(buildMergeCommand(videoPath, audioPath, outputPath), "merge audio into " + videoPath.getFileName());
        return outputPath;
    }

    @Override
    public Path concatCrossfade(CrossfadePlan plan, Path outputPath) throws AssemblyException, InterruptedException {
        if (plan.clips().size() < 2) {
            throw new AssemblyException("Crossfade concatenation needs at least two clips.");
        }
        runCommand(buildCrossfadeCommand(plan, outputPath), "crossfade " + plan.clips().size() + " clips");
        return outputPath;
    }

    @Override
    public Path concatLossless(List<Path> clipPaths, Path outputPath) throws AssemblyException, InterruptedException {
        if (clipPaths.isEmpty()) {
            throw new AssemblyException("Lossless concatenation needs at least one clip.");
        }

        Path listFile = null;
        try {
            listFile = Files.createTempFile(outputPath.toAbsolutePath().getParent(), "concat-", ".txt");
            Files.writeString(listFile, buildConcatListContent(clipPaths), StandardCharsets.UTF_8);
            runCommand(buildLosslessConcatCommand(listFile, outputPath), "lossless concat " + clipPaths.size() + " clips");
            return outputPath;
        } catch (IOException e) {
            throw new AssemblyException("Could not write concat list for " + outputPath, e);
        } finally {
            deleteIfExists(listFile);
        }
    }

    List<String> buildProbeCommand(Path mediaPath) {
        return List.of(
                resolveFfprobeBinary(),
                "-v",
                "error",
                "-print_format",
                "json",
                "-show_format",
                "-show_streams",
                mediaPath.toString());
    }

    List<String> buildExtractLastFrameCommand(Path videoPath, double seekSeconds, Path framePath) {
        return List.of(
                resolveFfmpegBinary(),
                "-y",
                "-ss",
                formatSeconds(seekSeconds),
                "-i",
                videoPath.toString(),
                "-frames:v",
                "1",
                "-f",
                "image2",
                framePath.toString());
    }

    List<String> buildMergeCommand(Path videoPath, Path audioPath, Path outputPath) {
        return List.of(
                resolveFfmpegBinary(),
                "-y",
                "-i",
                videoPath.toString(),
                "-i",
                audioPath.toString(),
                "-map",
                "0:v:0",
                "-map",
                "1:a:0",
                "-c:v",
                "copy",
                "-af",
                "apad",
                "-c:a",
                "aac",
                "-b:a",
                "192k",
                "-shortest",
                outputPath.toString());
    }

    List<String> buildCrossfadeCommand(CrossfadePlan plan, Path outputPath) {
        List<CrossfadeClip> clips = plan.clips();
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        for (CrossfadeClip clip : clips) {
            command.add("-i");
            command.add(clip.path().toString());
        }

        // Video-only clips get a generated silent track so audio can blend in the same windows.
        int[] audioInputIndex = new int[clips.size()];
        int nextInput = clips.size();
        for (int index = 0; index < clips.size(); index++) {
            CrossfadeClip clip = clips.get(index);
            if (clip.hasAudio()) {
                audioInputIndex[index] = index;
                continue;
            }
            command.add("-f");
            command.add("lavfi");
            command.add("-t");
            command.add(formatSeconds(clip.durationSeconds()));
            command.add("-i");
            command.add("anullsrc=channel_layout=stereo:sample_rate=" + AUDIO_SAMPLE_RATE);
            audioInputIndex[index] = nextInput++;
        }

        command.add("-filter_complex");
        command.add(buildCrossfadeFilter(plan, audioInputIndex));
        command.add("-map");
        command.add("[xv" + (clips.size() - 1) + "]");
        command.add("-map");
        command.add("[xa" + (clips.size() - 1) + "]");
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        command.add("-movflags");
        command.add("+faststart");
        command.add(outputPath.toString());
        return command;
    }

    String buildCrossfadeFilter(CrossfadePlan plan, int[] audioInputIndex) {
        List<CrossfadeClip> clips = plan.clips();
        List<String> chains = new ArrayList<>();

        for (int index = 0; index < clips.size(); index++) {
            CrossfadeClip clip = clips.get(index);
            chains.add("[" + index + ":v]fps=" + OUTPUT_FRAME_RATE
                    + ",scale=" + plan.width() + ":" + plan.height() + ":force_original_aspect_ratio=decrease"
                    + ",pad=" + plan.width() + ":" + plan.height() + ":(ow-iw)/2:(oh-ih)/2:black"
                    + ",setsar=1,format=yuv420p,settb=AVTB[v" + index + "]");
            chains.add("[" + audioInputIndex[index] + ":a]aformat=sample_rates=" + AUDIO_SAMPLE_RATE
                    + ":channel_layouts=stereo"
                    + ",apad=whole_dur=" + formatSeconds(clip.durationSeconds())
                    + ",atrim=0:" + formatSeconds(clip.durationSeconds())
                    + ",asetpts=PTS-STARTPTS[a" + index + "]");
        }

        String videoLabel = "[v0]";
        String audioLabel = "[a0]";
        String transition = formatSeconds(plan.transitionSec());
        for (int index = 1; index < clips.size(); index++) {
            String nextVideoLabel = "[xv" + index + "]";
            String nextAudioLabel = "[xa" + index + "]";
            chains.add(videoLabel + "[v" + index + "]xfade=transition=fade:duration=" + transition
                    + ":offset=" + formatSeconds(plan.offsetsSec().get(index - 1)) + nextVideoLabel);
            chains.add(audioLabel + "[a" + index + "]acrossfade=d=" + transition + ":c1=tri:c2=tri" + nextAudioLabel);
            videoLabel = nextVideoLabel;
            audioLabel = nextAudioLabel;
        }
        return String.join(";", chains);
    }

    List<String> buildLosslessConcatCommand(Path listFile, Path outputPath) {
        return List.of(
                resolveFfmpegBinary(),
                "-y",
                "-f",
                "concat",
                "-safe",
                "0",
                "-i",
                listFile.toString(),
                "-c",
                "copy",
                outputPath.toString());
    }

    String buildConcatListContent(List<Path> clipPaths) {
        StringBuilder content = new StringBuilder();
        for (Path clipPath : clipPaths) {
            String escaped = clipPath.toAbsolutePath().toString().replace("'", "'\\''");
            content.append("file '").append(escaped).append("'\n");
        }
        return content.toString();
    }

    MediaProbe parseProbeOutput(String output, Path mediaPath) throws AssemblyException {
        JsonNode root;
        try {
            root = objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new AssemblyException("Unreadable ffprobe output for " + mediaPath, e);
        }

        double duration = root.path("format").path("duration").asDouble(-1.0);
        int width = 0;
        int height = 0;
        boolean hasAudio = false;
        for (JsonNode stream : root.path("streams")) {
            String codecType = stream.path("codec_type").asText("");
            if ("video".equals(codecType) && width == 0) {
                width = stream.path("width").asInt(0);
                height = stream.path("height").asInt(0);
                if (duration <= 0) {
                    duration = stream.path("duration").asDouble(-1.0);
                }
            } else if ("audio".equals(codecType)) {
                hasAudio = true;
            }
        }

        if (duration <= 0) {
            throw new AssemblyException("ffprobe reported no duration for " + mediaPath);
        }
        return new MediaProbe(duration, width, height, hasAudio);
    }

    private String runCommand(List<String> command, String stage) throws AssemblyException, InterruptedException {
        logger.info("Running FFmpeg command for stage {}: {}", stage, String.join(" ", command));
        Path outputFile;
        try {
            outputFile = Files.createTempFile("scene-factory-ffmpeg-", ".log");
        } catch (IOException e) {
            throw new AssemblyException("Could not create output file for stage " + stage, e);
        }

        try {
            Process process;
            try {
                process = new ProcessBuilder(command)
                        .redirectErrorStream(true)
                        .redirectOutput(outputFile.toFile())
                        .start();
            } catch (IOException e) {
                throw new AssemblyException("Could not start " + command.get(0) + " for stage " + stage, e);
            }

            Duration timeout = assemblyProperties.commandTimeout();
            boolean finished;
            try {
                finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            }
            if (!finished) {
                process.destroyForcibly();
                throw new AssemblyException("FFmpeg timed out after " + timeout.toMillis() + " ms during stage: " + stage);
            }

            String output = readOutput(outputFile, stage);
            if (process.exitValue() != 0) {
                throw new AssemblyException(
                        "FFmpeg failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + output);
            }
            return output;
        } finally {
            deleteIfExists(outputFile);
        }
    }

    private String readOutput(Path outputFile, String stage) throws AssemblyException {
        try {
            return new String(Files.readAllBytes(outputFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AssemblyException("Could not read output of stage " + stage, e);
        }
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private String resolveFfmpegBinary() {
        return resolveBinary(assemblyProperties.ffmpegPath(), FFMPEG_PATH_ENV, DEFAULT_FFMPEG_BINARY);
    }

    private String resolveFfprobeBinary() {
        return resolveBinary(assemblyProperties.ffprobePath(), FFPROBE_PATH_ENV, DEFAULT_FFPROBE_BINARY);
    }

    private String resolveBinary(String configuredPath, String envName, String defaultBinary) {
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        String envPath = System.getenv(envName);
        if (envPath != null && !envPath.isBlank()) {
            return envPath;
        }
        return defaultBinary;
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete temporary file {}", path, e);
        }
    }
}
