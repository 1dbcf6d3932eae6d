package github.sarthakdev143.scene_factory.integration.runware;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import github.sarthakdev143.scene_factory.config.RunwareProps;
import github.sarthakdev143.scene_factory.exception.ExternalServiceException;
import github.sarthakdev143.scene_factory.exception.GenerationException;
import github.sarthakdev143.scene_factory.exception.SeedTransferException;
import github.sarthakdev143.scene_factory.model.AudioGenerationRequest;
import github.sarthakdev143.scene_factory.model.GenerationTaskResult;
import github.sarthakdev143.scene_factory.model.GenerationTaskState;
import github.sarthakdev143.scene_factory.model.ImageGenerationRequest;
import github.sarthakdev143.scene_factory.model.VideoGenerationRequest;
import github.sarthakdev143.scene_factory.service.GenerationClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Generation client for the Runware task API. Every call posts a one-element task array to the base
 * URL; inference tasks are submitted with asynchronous delivery and polled with {@code getResponse}.
 */
@Component
public class RunwareGenerationClient implements GenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(RunwareGenerationClient.class);
    private static final List<String> SEED_TRANSFER_CODES = List.of("failedToTransferImage", "failedToTransfer");
    private static final List<String> RESULT_URL_FIELDS =
            List.of("videoURL", "imageURL", "audioURL", "outputURL", "url");

    private final RestClient restClient;
    private final RunwareProps props;
    private final ObjectMapper objectMapper;

    @Autowired
    public RunwareGenerationClient(RestClient.Builder restClientBuilder, RunwareProps props, ObjectMapper objectMapper) {
        this(restClientBuilder
                        .baseUrl(props.baseUrl())
                        .requestFactory(requestFactory(props))
                        .build(),
                props,
                objectMapper);
    }

    RunwareGenerationClient(RestClient restClient, RunwareProps props, ObjectMapper objectMapper) {
        this.restClient = restClient;
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    public String submitVideo(VideoGenerationRequest request) throws GenerationException {
        ObjectNode task = newTask("videoInference");
        task.put("model", props.videoModel());
        task.put("positivePrompt", request.prompt());
        task.put("duration", request.durationSeconds());
        task.put("width", request.width());
        task.put("height", request.height());
        task.put("outputType", "URL");
        task.put("outputFormat", "MP4");
        task.put("deliveryMethod", "async");
        task.put("numberResults", 1);
        if (request.seedImageHandle() != null && !request.seedImageHandle().isBlank()) {
            ObjectNode frame = task.putArray("frameImages").addObject();
            frame.put("inputImage", request.seedImageHandle());
            frame.put("frame", "first");
        }
        return submit(task, "video");
    }

    @Override
    public String submitImage(ImageGenerationRequest request) throws GenerationException {
        ObjectNode task = newTask("imageInference");
        task.put("model", props.imageModel());
        task.put("positivePrompt", request.prompt());
        task.put("width", request.width());
        task.put("height", request.height());
        task.put("outputType", "URL");
        task.put("outputFormat", "PNG");
        task.put("deliveryMethod", "async");
        task.put("numberResults", 1);
        return submit(task, "image");
    }

    @Override
    public String submitAudio(AudioGenerationRequest request) throws GenerationException {
        ObjectNode task = newTask("audioInference");
        task.put("model", props.audioModel());
        task.put("positivePrompt", request.prompt());
        task.put("duration", request.durationSeconds());
        task.put("outputType", "URL");
        task.put("outputFormat", "MP3");
        task.put("deliveryMethod", "async");
        task.put("numberResults", 1);
        return submit(task, "audio");
    }

    @Override
    public GenerationTaskResult poll(String taskId) throws GenerationException {
        ObjectNode task = objectMapper.createObjectNode();
        task.put("taskType", "getResponse");
        task.put("taskUUID", taskId);
        JsonNode response = post(task, "status of " + taskId);

        JsonNode error = findError(response, taskId);
        if (error != null) {
            String message = errorMessage(error);
            if (isSeedTransferError(error)) {
                throw new SeedTransferException("Task " + taskId + " could not fetch its seed image: " + message);
            }
            return GenerationTaskResult.error(taskId, message);
        }

        JsonNode item = findItem(response, taskId);
        if (item == null) {
            return new GenerationTaskResult(taskId, GenerationTaskState.QUEUED, null, null);
        }
        return toTaskResult(taskId, item);
    }

    @Override
    public String uploadReference(Path imagePath) throws GenerationException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(imagePath);
        } catch (IOException e) {
            throw new ExternalServiceException("Could not read reference image " + imagePath, e);
        }

        ObjectNode task = newTask("imageUpload");
        task.put("image", "data:image/png;base64," + Base64.getEncoder().encodeToString(bytes));
        String taskId = task.path("taskUUID").asText();
        JsonNode response = post(task, "image upload");
        JsonNode error = findError(response, taskId);
        if (error != null) {
            throw new ExternalServiceException("Image upload failed: " + errorMessage(error));
        }

        JsonNode item = findItem(response, taskId);
        String imageUuid = item == null ? null : item.path("imageUUID").asText(null);
        if (imageUuid == null || imageUuid.isBlank()) {
            throw new ExternalServiceException("Image upload response is missing imageUUID.");
        }
        logger.debug("Uploaded reference image {} as {}", imagePath.getFileName(), imageUuid);
        return imageUuid;
    }

    @Override
    public void download(String uri, Path destination) throws GenerationException {
        byte[] body;
        try {
            body = restClient.get()
                    .uri(URI.create(uri))
                    .retrieve()
                    .body(byte[].class);
        } catch (IllegalArgumentException | RestClientException e) {
            throw new ExternalServiceException("Download of " + uri + " failed: " + e.getMessage(), e);
        }
        if (body == null || body.length == 0) {
            throw new ExternalServiceException("Download of " + uri + " returned no content.");
        }
        try {
            Files.write(destination, body);
        } catch (IOException e) {
            throw new ExternalServiceException("Could not write " + destination, e);
        }
    }

    GenerationTaskResult toTaskResult(String taskId, JsonNode item) {
        String resultUri = resultUrl(item);
        String status = item.path("status").asText("").toLowerCase(Locale.ROOT);
        switch (status) {
            case "processing", "pending" -> {
                return GenerationTaskResult.running(taskId);
            }
            case "success", "completed", "done" -> {
                return GenerationTaskResult.done(taskId, resultUri);
            }
            case "error", "failed" -> {
                return GenerationTaskResult.error(taskId, errorMessage(item));
            }
            default -> {
                if (resultUri != null) {
                    return GenerationTaskResult.done(taskId, resultUri);
                }
                return new GenerationTaskResult(taskId, GenerationTaskState.QUEUED, null, null);
            }
        }
    }

    private String submit(ObjectNode task, String kind) throws GenerationException {
        String taskId = task.path("taskUUID").asText();
        JsonNode response = post(task, kind + " submission");
        JsonNode error = findError(response, taskId);
        if (error != null) {
            String message = errorMessage(error);
            if (isSeedTransferError(error)) {
                throw new SeedTransferException("Seed image transfer failed for " + kind + " task: " + message);
            }
            throw new ExternalServiceException("Runware rejected " + kind + " task: " + message);
        }
        JsonNode item = findItem(response, taskId);
        String acceptedId = item == null ? null : item.path("taskUUID").asText(null);
        logger.info("Submitted Runware {} task {}", kind, acceptedId != null ? acceptedId : taskId);
        return acceptedId != null && !acceptedId.isBlank() ? acceptedId : taskId;
    }

    private JsonNode post(ObjectNode task, String stage) throws GenerationException {
        ArrayNode payload = objectMapper.createArrayNode();
        payload.add(task);
        try {
            JsonNode response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                throw new ExternalServiceException("Runware response is empty for " + stage + ".");
            }
            return response;
        } catch (RestClientResponseException e) {
            // Rejections carry the usual errors array in the body.
            JsonNode body = parseErrorBody(e.getResponseBodyAsString());
            if (body != null && body.path("errors").size() > 0) {
                return body;
            }
            throw new ExternalServiceException(
                    "Runware returned HTTP " + e.getStatusCode().value() + " for " + stage + ".", e);
        } catch (ResourceAccessException e) {
            throw new ExternalServiceException("Runware is unreachable during " + stage + ": " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ExternalServiceException("Runware call failed during " + stage + ": " + e.getMessage(), e);
        }
    }

    private ObjectNode newTask(String taskType) {
        ObjectNode task = objectMapper.createObjectNode();
        task.put("taskType", taskType);
        task.put("taskUUID", UUID.randomUUID().toString());
        return task;
    }

    private JsonNode parseErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private JsonNode findError(JsonNode response, String taskId) {
        JsonNode errors = response.path("errors");
        if (!errors.isArray() || errors.isEmpty()) {
            return null;
        }
        for (JsonNode error : errors) {
            if (taskId.equals(error.path("taskUUID").asText(null))) {
                return error;
            }
        }
        return errors.get(0);
    }

    private JsonNode findItem(JsonNode response, String taskId) {
        JsonNode data = response.has("data") ? response.path("data") : response.path("results");
        if (!data.isArray() || data.isEmpty()) {
            return null;
        }
        for (JsonNode item : data) {
            if (taskId.equals(item.path("taskUUID").asText(null))) {
                return item;
            }
        }
        return data.get(0);
    }

    private boolean isSeedTransferError(JsonNode error) {
        String code = error.path("code").asText("");
        String text = errorMessage(error);
        for (String seedCode : SEED_TRANSFER_CODES) {
            if (code.equals(seedCode) || text.contains(seedCode)) {
                return true;
            }
        }
        return false;
    }

    private String errorMessage(JsonNode node) {
        for (String field : List.of("message", "error", "errorMessage", "code")) {
            String value = node.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "unknown provider error";
    }

    private String resultUrl(JsonNode item) {
        for (String field : RESULT_URL_FIELDS) {
            String value = item.path(field).asText(null);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }

    private static SimpleClientHttpRequestFactory requestFactory(RunwareProps props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.connectTimeout());
        factory.setReadTimeout(props.readTimeout());
        return factory;
    }
}
