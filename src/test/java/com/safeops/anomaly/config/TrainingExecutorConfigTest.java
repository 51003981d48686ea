package com.safeops.anomaly.config;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

class TrainingExecutorConfigTest {

    @Test
    void trainingExecutor_isBoundedAndRejectsWhenFull() {
        DetectorProperties properties = new DetectorProperties();
        properties.getTraining().setPoolSize(2);
        properties.getTraining().setQueueCapacity(3);

        ThreadPoolTaskExecutor executor = new TrainingExecutorConfig().trainingExecutor(properties);
        try {
            ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
            assertThat(pool.getCorePoolSize()).isEqualTo(2);
            assertThat(pool.getMaximumPoolSize()).isEqualTo(2);
            assertThat(pool.getQueue().remainingCapacity()).isEqualTo(3);
            assertThat(pool.getRejectedExecutionHandler()).isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        } finally {
            executor.shutdown();
        }
    }
}
