package github.sarthakdev143.scene_factory.service;

import github.sarthakdev143.scene_factory.exception.GenerationException;
import github.sarthakdev143.scene_factory.model.AudioGenerationRequest;
import github.sarthakdev143.scene_factory.model.GenerationTaskResult;
import github.sarthakdev143.scene_factory.model.ImageGenerationRequest;
import github.sarthakdev143.scene_factory.model.VideoGenerationRequest;

import java.nio.file.Path;

public interface GenerationClient {

    String submitVideo(VideoGenerationRequest request) throws GenerationException;

    String submitImage(ImageGenerationRequest request) throws GenerationException;

    String submitAudio(AudioGenerationRequest request) throws GenerationException;

    GenerationTaskResult poll(String taskId) throws GenerationException;

    /**
     * Uploads a local image and returns a handle usable as a seed or reference in later requests.
     */
    String uploadReference(Path imagePath) throws GenerationException;

    void download(String uri, Path destination) throws GenerationException;
}
