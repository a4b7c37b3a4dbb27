package it.unimib.datai.fnship.deployer.compute;

import it.unimib.datai.fnship.common.model.DeployOptions;
import it.unimib.datai.fnship.common.model.FunctionConfiguration;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;

public class FunctionConfigurationResolver {
    private final FunctionDefaults defaults;

    public FunctionConfigurationResolver(FunctionDefaults defaults) {
        this.defaults = defaults;
    }

    public FunctionConfiguration resolve(DeployOptions options) {
        DeployOptions opts = options == null ? DeployOptions.defaults() : options;
        int timeout = opts.timeout() == null ? defaults.timeoutSeconds() : opts.timeout();
        int memory = opts.memorySize() == null ? defaults.memorySizeMb() : opts.memorySize();
        if (timeout < 1) {
            throw new InvalidInputException("timeout must be at least 1 second, got " + timeout);
        }
        if (memory < 1) {
            throw new InvalidInputException("memorySize must be positive, got " + memory);
        }
        return new FunctionConfiguration(
                firstNonBlank(opts.runtime(), defaults.runtime()),
                firstNonBlank(opts.handler(), defaults.handler()),
                timeout,
                memory,
                firstNonBlank(opts.description(), defaults.description())
        );
    }

    public String resolveRuntime(String runtime) {
        return firstNonBlank(runtime, defaults.runtime());
    }

    private static String firstNonBlank(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
