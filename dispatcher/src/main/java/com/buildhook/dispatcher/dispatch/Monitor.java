package com.buildhook.dispatcher.dispatch;

import com.buildhook.dispatcher.handler.BuildConsistencyException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Handler telemetry and error reporting.
 *
 * <pre>
 *   buildhook.handler.duration{handler}
 *   buildhook.handler.calls{handler, status="success|error"}
 *   buildhook.handler.errors{handler, kind=&lt;exception class&gt;}
 *   buildhook.consistency.violations{handler}
 * </pre>
 */
@Component
public class Monitor {

    private static final Logger log = LoggerFactory.getLogger(Monitor.class);

    private final MeterRegistry meterRegistry;

    public Monitor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCall(String handler, Timer.Sample sample, boolean success) {
        sample.stop(meterRegistry.timer("buildhook.handler.duration", "handler", handler));
        meterRegistry.counter("buildhook.handler.calls",
                "handler", handler, "status", success ? "success" : "error").increment();
    }

    /**
     * Report a handler failure. The message is still acknowledged; a lost
     * event shows up here and in the error counter, not as a stuck consumer.
     */
    public void reportError(String handler, Throwable error) {
        if (error instanceof BuildConsistencyException e) {
            log.error("DATA CONSISTENCY VIOLATION in {} handler for task group {}: {}",
                    handler, e.getTaskGroupId(), e.getMessage(), e);
            meterRegistry.counter("buildhook.consistency.violations", "handler", handler).increment();
            return;
        }
        log.error("Error while calling {} handler: {}", handler, error.getMessage(), error);
        meterRegistry.counter("buildhook.handler.errors",
                "handler", handler, "kind", error.getClass().getSimpleName()).increment();
    }
}
