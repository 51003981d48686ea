package com.safeops.anomaly.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded pool that runs model training off the request threads.
 * When every worker is busy and the queue is full, new trainings are rejected.
 */
@Configuration
public class TrainingExecutorConfig {

    public static final String TRAINING_EXECUTOR = "trainingExecutor";

    @Bean(TRAINING_EXECUTOR)
    @Qualifier(TRAINING_EXECUTOR)
    public ThreadPoolTaskExecutor trainingExecutor(DetectorProperties properties) {
        DetectorProperties.Training training = properties.getTraining();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(training.getPoolSize());
        executor.setMaxPoolSize(training.getPoolSize());
        executor.setQueueCapacity(training.getQueueCapacity());
        executor.setThreadNamePrefix("model-train-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
