package it.unimib.datai.fnship.deployer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

public class DeployerMetrics {
    static final String OPERATION_TOTAL = "fnship_operation_total";
    static final String OPERATION_DURATION = "fnship_operation_duration";

    private final MeterRegistry registry;

    public DeployerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void success(String operation, String function, Duration elapsed) {
        counter(operation, function, "success").increment();
        timer(operation, function).record(elapsed);
    }

    public void failure(String operation, String function, Throwable error) {
        counter(operation, function, outcomeOf(error)).increment();
    }

    private Counter counter(String operation, String function, String outcome) {
        return Counter.builder(OPERATION_TOTAL)
                .tag("operation", operation)
                .tag("function", function == null ? "" : function)
                .tag("outcome", outcome)
                .register(registry);
    }

    private Timer timer(String operation, String function) {
        return Timer.builder(OPERATION_DURATION)
                .tag("operation", operation)
                .tag("function", function == null ? "" : function)
                .register(registry);
    }

    private static String outcomeOf(Throwable error) {
        String type = error.getClass().getSimpleName();
        if (type.endsWith("TimeoutException")) {
            return "timeout";
        }
        if ("InvalidInputException".equals(type)) {
            return "invalid";
        }
        return "error";
    }
}
