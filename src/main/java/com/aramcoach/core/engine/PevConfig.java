package com.aramcoach.core.engine;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PevConfig {

    /**
     * Threads for draft generation calls, so a run can time out or cancel a
     * call without blocking on it.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService generationExecutor() {
        var counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "pev-generation-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
