package github.sarthakdev143.scene_factory.service.impl;

import github.sarthakdev143.scene_factory.config.SceneFactoryProperties;
import github.sarthakdev143.scene_factory.exception.ExternalServiceException;
import github.sarthakdev143.scene_factory.exception.GenerationException;
import github.sarthakdev143.scene_factory.exception.GenerationTimeoutException;
import github.sarthakdev143.scene_factory.model.GenerationTaskResult;
import github.sarthakdev143.scene_factory.service.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Polls a submitted generation task until it settles or the wait budget runs out.
 */
@Component
public class GenerationTaskAwaiter {

    private static final Logger logger = LoggerFactory.getLogger(GenerationTaskAwaiter.class);

    private final GenerationClient generationClient;
    private final Duration pollInterval;
    private final Duration maxWait;

    @Autowired
    public GenerationTaskAwaiter(GenerationClient generationClient, SceneFactoryProperties properties) {
        this(generationClient, properties.generation().pollInterval(), properties.generation().maxTaskWait());
    }

    GenerationTaskAwaiter(GenerationClient generationClient, Duration pollInterval, Duration maxWait) {
        this.generationClient = generationClient;
        this.pollInterval = pollInterval;
        this.maxWait = maxWait;
    }

    /**
     * Returns the result URI of a finished task.
     *
     * @throws GenerationTimeoutException when the task is still unfinished after the wait budget
     * @throws ExternalServiceException   when the provider reports an error or a result without a URI
     */
    public String await(String taskId, String label) throws GenerationException, InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        int polls = 0;
        while (true) {
            GenerationTaskResult result = generationClient.poll(taskId);
            polls++;
            switch (result.state()) {
                case DONE -> {
                    if (result.resultUri() == null || result.resultUri().isBlank()) {
                        throw new ExternalServiceException(
                                "Task " + taskId + " for " + label + " finished without a result.");
                    }
                    logger.debug("Task {} for {} finished after {} polls", taskId, label, polls);
                    return result.resultUri();
                }
                case ERROR -> throw new ExternalServiceException(
                        "Task " + taskId + " for " + label + " failed: "
                                + (result.error() == null ? "unknown provider error" : result.error()));
                default -> {
                    // still queued or running
                }
            }

            if (System.nanoTime() - deadline >= 0) {
                throw new GenerationTimeoutException(
                        "Task " + taskId + " for " + label + " did not finish within " + maxWait.toSeconds() + "s.");
            }
            Thread.sleep(pollInterval.toMillis());
        }
    }
}
