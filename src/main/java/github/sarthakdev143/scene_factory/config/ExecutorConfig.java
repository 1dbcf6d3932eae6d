package github.sarthakdev143.scene_factory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class ExecutorConfig {

    /**
     * Runs one detached pipeline per generation job. Unrelated jobs only share this pool.
     */
    @Bean(name = "sceneJobExecutor")
    public ThreadPoolTaskExecutor sceneJobExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("scene-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /**
     * Fan-out tasks. Each fan-out call bounds its own concurrency, this pool only caps the total.
     */
    @Bean(name = "generationTaskExecutor")
    public ThreadPoolTaskExecutor generationTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("scene-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
