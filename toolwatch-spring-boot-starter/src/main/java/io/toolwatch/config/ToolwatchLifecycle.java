package io.toolwatch.config;

import io.toolwatch.CompetitiveMonitor;
import io.toolwatch.alert.AlertIntegrationManager;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Bridges monitor and alert-flush start/stop with the Spring container lifecycle.
 *
 * <p>The alert integration starts before the monitor and stops after it, so pending alerts produced by
 * the last jobs are still flushed. Without a monitor only the alert integration is managed.
 */
public class ToolwatchLifecycle implements SmartLifecycle {
    private final CompetitiveMonitor monitor;
    private final AlertIntegrationManager alertIntegration;
    private volatile boolean running = false;

    public ToolwatchLifecycle(CompetitiveMonitor monitor, AlertIntegrationManager alertIntegration) {
        this.monitor = monitor;
        this.alertIntegration = Objects.requireNonNull(alertIntegration, "alertIntegration must not be null");
    }

    @Override
    public void start() {
        alertIntegration.start();
        if (monitor != null) {
            monitor.start();
        }
        running = true;
    }

    @Override
    public void stop() {
        try {
            if (monitor != null) {
                monitor.stop();
            }
        } finally {
            alertIntegration.stop();
            running = false;
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
