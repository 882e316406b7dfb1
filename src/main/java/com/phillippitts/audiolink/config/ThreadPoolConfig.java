package com.phillippitts.audiolink.config;

import com.phillippitts.audiolink.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs demodulation.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties based on hardware and workload.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the bounded executor for demodulation work.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.modem.*} properties:
     * <ul>
     *   <li>Core pool: default 4 - one per modem instance</li>
     *   <li>Max pool: default 8 - absorbs workers still winding down after a timeout</li>
     *   <li>Queue: default 32 tasks - prevents unbounded memory growth</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running a decode on the
     * request thread would escape the decode timeout, so a saturated pool rejects instead
     * and the request gets {@code MODEM_UNAVAILABLE}.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so decode logs keep the request ID.
     *
     * @return Configured executor for demodulation
     */
    @Bean(name = "modemExecutor")
    public ThreadPoolTaskExecutor modemExecutor() {
        ThreadPoolProperties.ModemPoolProperties modemProps = threadPoolProperties.getModem();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(modemProps.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(modemProps.getMaxPoolSize(), modemProps.getCorePoolSize()));
        executor.setQueueCapacity(modemProps.getQueueCapacity());
        executor.setThreadNamePrefix(modemProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(modemProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
