package it.unimib.datai.fnship.deployer.config;

import it.unimib.datai.fnship.deployer.compute.FunctionDefaults;

import java.time.Duration;

/**
 * Settings of a deployer instance. Passed in at construction; nothing is read from process-wide state.
 */
public record DeployerProperties(
        String defaultRoleName,
        String trustPolicy,
        String managedPolicyArn,
        FunctionDefaults functionDefaults,
        Duration activationTimeout,
        Duration updateTimeout,
        Duration pollInterval
) {
    public static final String DEFAULT_ROLE_NAME = "fnship-lambda-role";
    public static final String LAMBDA_BASIC_EXECUTION_POLICY =
            "arn:aws:iam::aws:policy/service-role/AWSLambdaBasicExecutionRole";
    public static final String LAMBDA_TRUST_POLICY = """
            {
              "Version": "2012-10-17",
              "Statement": [
                {
                  "Effect": "Allow",
                  "Principal": { "Service": "lambda.amazonaws.com" },
                  "Action": "sts:AssumeRole"
                }
              ]
            }
            """;
    public static final Duration DEFAULT_ACTIVATION_TIMEOUT = Duration.ofSeconds(180);
    public static final Duration DEFAULT_UPDATE_TIMEOUT = Duration.ofSeconds(180);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(1);

    public DeployerProperties {
        defaultRoleName = defaultRoleName == null || defaultRoleName.isBlank() ? DEFAULT_ROLE_NAME : defaultRoleName;
        trustPolicy = trustPolicy == null || trustPolicy.isBlank() ? LAMBDA_TRUST_POLICY : trustPolicy;
        managedPolicyArn = managedPolicyArn == null || managedPolicyArn.isBlank()
                ? LAMBDA_BASIC_EXECUTION_POLICY
                : managedPolicyArn;
        functionDefaults = functionDefaults == null ? FunctionDefaults.standard() : functionDefaults;
        activationTimeout = positiveOr(activationTimeout, DEFAULT_ACTIVATION_TIMEOUT);
        updateTimeout = positiveOr(updateTimeout, DEFAULT_UPDATE_TIMEOUT);
        pollInterval = positiveOr(pollInterval, DEFAULT_POLL_INTERVAL);
    }

    public static DeployerProperties defaults() {
        return new DeployerProperties(null, null, null, null, null, null, null);
    }

    public DeployerProperties withDefaultRoleName(String roleName) {
        return new DeployerProperties(roleName, trustPolicy, managedPolicyArn, functionDefaults,
                activationTimeout, updateTimeout, pollInterval);
    }

    public DeployerProperties withActivationTimeout(Duration timeout) {
        return new DeployerProperties(defaultRoleName, trustPolicy, managedPolicyArn, functionDefaults,
                timeout, updateTimeout, pollInterval);
    }

    public DeployerProperties withUpdateTimeout(Duration timeout) {
        return new DeployerProperties(defaultRoleName, trustPolicy, managedPolicyArn, functionDefaults,
                activationTimeout, timeout, pollInterval);
    }

    public DeployerProperties withPollInterval(Duration interval) {
        return new DeployerProperties(defaultRoleName, trustPolicy, managedPolicyArn, functionDefaults,
                activationTimeout, updateTimeout, interval);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isNegative() || value.isZero() ? fallback : value;
    }
}
