package com.practiceacademy.tournament.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class GenerationWorkerConfig {

    @Bean(name = "generationWorkerExecutor")
    public ThreadPoolTaskExecutor generationWorkerExecutor(TournamentEngineProperties properties) {
        int poolSize = Math.max(1, properties.getWorker().getPoolSize());
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(poolSize);
        exec.setMaxPoolSize(poolSize);
        exec.setQueueCapacity(500);
        exec.setThreadNamePrefix("tournament-generation-");
        exec.setWaitForTasksToCompleteOnShutdown(true);
        exec.initialize();
        return exec;
    }
}
