package com.goormthonuniv.newscheckr.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${newscheckr.executor.analysis.core-pool-size:4}")
    private int analysisCorePoolSize;

    @Value("${newscheckr.executor.analysis.max-pool-size:8}")
    private int analysisMaxPoolSize;

    @Value("${newscheckr.executor.analysis.queue-capacity:200}")
    private int analysisQueueCapacity;

    @Value("${newscheckr.executor.scrape.core-pool-size:4}")
    private int scrapeCorePoolSize;

    @Value("${newscheckr.executor.scrape.max-pool-size:8}")
    private int scrapeMaxPoolSize;

    @Value("${newscheckr.executor.scrape.queue-capacity:50}")
    private int scrapeQueueCapacity;

    /**
     * 신뢰도/성향 분류 병렬 실행. 포화 시 호출 스레드에서 직접 실행
     */
    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        return executor("analysis-", analysisCorePoolSize, analysisMaxPoolSize, analysisQueueCapacity, 30,
                callerRunsUnlessShutdown("analysis-"));
    }

    /**
     * 외부 기사 수집 전용. 동시 연결 수 상한 역할이므로 포화 시 즉시 거절(TaskRejectedException)
     */
    @Bean(name = "scrapeExecutor")
    public ThreadPoolTaskExecutor scrapeExecutor() {
        return executor("scrape-", scrapeCorePoolSize, scrapeMaxPoolSize, scrapeQueueCapacity, 15,
                new ThreadPoolExecutor.AbortPolicy());
    }

    static RejectedExecutionHandler callerRunsUnlessShutdown(String prefix) {
        return (r, e) -> {
            if (e.isShutdown()) {
                throw new RejectedExecutionException(prefix + "executor is shut down");
            }
            log.warn("Task rejected from {}executor, running on caller thread", prefix);
            r.run();
        };
    }

    static ThreadPoolTaskExecutor executor(String prefix, int core, int max, int queue, int awaitSeconds,
                                           RejectedExecutionHandler rejectionHandler) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(awaitSeconds);
        executor.setRejectedExecutionHandler(rejectionHandler);
        executor.initialize();
        return executor;
    }
}
