package github.sarthakdev143.scene_factory.support;

import github.sarthakdev143.scene_factory.exception.ExternalServiceException;
import github.sarthakdev143.scene_factory.exception.GenerationException;
import github.sarthakdev143.scene_factory.model.AudioGenerationRequest;
import github.sarthakdev143.scene_factory.model.GenerationTaskResult;
import github.sarthakdev143.scene_factory.model.ImageGenerationRequest;
import github.sarthakdev143.scene_factory.model.VideoGenerationRequest;
import github.sarthakdev143.scene_factory.service.GenerationClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * In-memory generation provider. Every task finishes on its first poll. Failures are scripted per
 * prompt marker: a submission whose prompt contains the marker throws the next queued exception.
 */
public class FakeGenerationClient implements GenerationClient {

    private final AtomicInteger sequence = new AtomicInteger();
    private final Map<String, String> resultUris = new ConcurrentHashMap<>();
    private final Map<String, Double> uriDurations = new ConcurrentHashMap<>();
    private final Map<Path, Double> fileDurations = new ConcurrentHashMap<>();
    private final Map<String, Deque<GenerationException>> videoFailures = new ConcurrentHashMap<>();
    private final Set<String> failingImageMarkers = ConcurrentHashMap.newKeySet();
    private final Set<String> failingAudioMarkers = ConcurrentHashMap.newKeySet();
    private final List<VideoGenerationRequest> videoRequests = Collections.synchronizedList(new ArrayList<>());
    private final List<AudioGenerationRequest> audioRequests = Collections.synchronizedList(new ArrayList<>());
    private final List<Path> uploads = Collections.synchronizedList(new ArrayList<>());
    private volatile Consumer<VideoGenerationRequest> onVideoSubmit = request -> {
    };
    private volatile boolean failUploads;

    public void failVideo(String promptMarker, GenerationException... failures) {
        videoFailures.computeIfAbsent(promptMarker, ignored -> new ArrayDeque<>()).addAll(List.of(failures));
    }

    public void failImage(String promptMarker) {
        failingImageMarkers.add(promptMarker);
    }

    public void failAudio(String promptMarker) {
        failingAudioMarkers.add(promptMarker);
    }

    public void failUploads(boolean failUploads) {
        this.failUploads = failUploads;
    }

    public void onVideoSubmit(Consumer<VideoGenerationRequest> hook) {
        this.onVideoSubmit = hook;
    }

    public List<VideoGenerationRequest> videoRequests() {
        synchronized (videoRequests) {
            return List.copyOf(videoRequests);
        }
    }

    public List<AudioGenerationRequest> audioRequests() {
        synchronized (audioRequests) {
            return List.copyOf(audioRequests);
        }
    }

    public List<Path> uploads() {
        synchronized (uploads) {
            return List.copyOf(uploads);
        }
    }

    /**
     * Duration of a downloaded file, or null for files this client never wrote.
     */
    public Double durationOf(Path file) {
        return fileDurations.get(file);
    }

    @Override
    public synchronized String submitVideo(VideoGenerationRequest request) throws GenerationException {
        onVideoSubmit.accept(request);
        videoRequests.add(request);
        for (Map.Entry<String, Deque<GenerationException>> entry : videoFailures.entrySet()) {
            if (request.prompt().contains(entry.getKey()) && !entry.getValue().isEmpty()) {
                throw entry.getValue().poll();
            }
        }
        return newTask("video", request.durationSeconds());
    }

    @Override
    public String submitImage(ImageGenerationRequest request) throws GenerationException {
        for (String marker : failingImageMarkers) {
            if (request.prompt().contains(marker)) {
                throw new ExternalServiceException("image rejected for " + marker);
            }
        }
        return newTask("image", 0);
    }

    @Override
    public String submitAudio(AudioGenerationRequest request) throws GenerationException {
        audioRequests.add(request);
        for (String marker : failingAudioMarkers) {
            if (request.prompt().contains(marker)) {
                throw new ExternalServiceException("audio rejected for " + marker);
            }
        }
        return newTask("audio", request.durationSeconds());
    }

    @Override
    public GenerationTaskResult poll(String taskId) throws GenerationException {
        String uri = resultUris.get(taskId);
        if (uri == null) {
            return GenerationTaskResult.error(taskId, "unknown task");
        }
        return GenerationTaskResult.done(taskId, uri);
    }

    @Override
    public String uploadReference(Path imagePath) throws GenerationException {
        if (failUploads) {
            throw new ExternalServiceException("upload rejected");
        }
        uploads.add(imagePath);
        return "ref-" + imagePath.getFileName();
    }

    @Override
    public void download(String uri, Path destination) throws GenerationException {
        try {
            Files.createDirectories(destination.getParent());
            Files.writeString(destination, uri, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExternalServiceException("could not write " + destination, e);
        }
        fileDurations.put(destination, uriDurations.getOrDefault(uri, 0.0));
    }

    private String newTask(String kind, int durationSeconds) {
        String taskId = kind + "-" + sequence.incrementAndGet();
        String uri = "mem://" + taskId;
        resultUris.put(taskId, uri);
        uriDurations.put(uri, (double) durationSeconds);
        return taskId;
    }
}
