package github.sarthakdev143.music_video_studio.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableConfigurationProperties({PipelineProperties.class, GeminiProperties.class, StorageProperties.class})
public class PipelineExecutionConfig {

    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    @Bean
    public ThreadPoolTaskExecutor generationTaskExecutor(PipelineProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.generationThreads());
        executor.setMaxPoolSize(properties.generationThreads());
        // Unbounded: a batch is submitted whole and scenes beyond the pool size wait for a thread.
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("scene-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskExecutor pipelineTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("pipeline-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ThreadPoolTaskScheduler pipelineTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("pipeline-cooldown-");
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public RestTemplate geminiRestTemplate(RestTemplateBuilder builder) {
        return builder
                .connectTimeout(Duration.ofSeconds(15))
                .readTimeout(Duration.ofMinutes(2))
                .build();
    }
}
