package it.unimib.datai.fnship.cli.commands;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import it.unimib.datai.fnship.aws.AwsFunctionDeployers;
import it.unimib.datai.fnship.aws.AwsSettings;
import it.unimib.datai.fnship.cli.config.ResolvedContext;
import it.unimib.datai.fnship.deployer.config.DeployerProperties;
import it.unimib.datai.fnship.deployer.service.FunctionDeployer;

import java.net.URI;
import java.time.Duration;

@FunctionalInterface
public interface DeployerFactory {

    FunctionDeployer create(ResolvedContext context);

    static DeployerFactory aws() {
        return context -> AwsFunctionDeployers.create(settings(context), properties(context), new SimpleMeterRegistry());
    }

    static AwsSettings settings(ResolvedContext context) {
        URI endpoint = context.endpoint() == null ? null : URI.create(context.endpoint());
        return new AwsSettings(context.region(), endpoint, context.profile());
    }

    static DeployerProperties properties(ResolvedContext context) {
        DeployerProperties properties = DeployerProperties.defaults().withDefaultRoleName(context.roleName());
        if (context.activationTimeoutSeconds() != null) {
            properties = properties.withActivationTimeout(Duration.ofSeconds(context.activationTimeoutSeconds()));
        }
        return properties;
    }
}
