package github.sarthakdev143.scene_factory.exception;

public class GenerationJobNotFoundException extends RuntimeException {

    public GenerationJobNotFoundException(String message) {
        super(message);
    }

    public static GenerationJobNotFoundException job(String jobId) {
        return new GenerationJobNotFoundException("Job not found for id: " + jobId);
    }

    public static GenerationJobNotFoundException scene(String jobId, String scenario) {
        return new GenerationJobNotFoundException("Scenario " + scenario + " not found in job " + jobId);
    }
}
