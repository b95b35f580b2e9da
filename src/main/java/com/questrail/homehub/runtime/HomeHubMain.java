package com.questrail.homehub.runtime;

import com.questrail.homehub.config.HubConfig;
import com.questrail.homehub.observability.Slf4jHubObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Configuration comes from environment variables, see
 * {@link HubConfig#fromEnvironment(java.util.Map)}.
 */
public final class HomeHubMain {
    private static final Logger log = LoggerFactory.getLogger(HomeHubMain.class);

    private HomeHubMain() {
    }

    public static void main(String[] args) throws InterruptedException {
        HubConfig config;
        try {
            config = HubConfig.fromEnvironment(System.getenv());
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        log.info("Starting home hub with {}", config.mqtt());

        HubRuntime runtime = HubRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jHubObservabilitySink())
                .build();

        try {
            runtime.start();
        } catch (HubStartupException e) {
            log.error("Startup failed: {}", e.getMessage(), e.getCause());
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            stopped.countDown();
        }, "homehub-shutdown"));
        stopped.await();
    }
}
