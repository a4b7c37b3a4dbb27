package it.unimib.datai.fnship.aws;

import io.micrometer.core.instrument.MeterRegistry;
import it.unimib.datai.fnship.deployer.config.DeployerProperties;
import it.unimib.datai.fnship.deployer.service.FunctionDeployer;

/**
 * Builds a {@link FunctionDeployer} wired to IAM and Lambda.
 * Closing the deployer closes both SDK clients.
 */
public final class AwsFunctionDeployers {

    private AwsFunctionDeployers() {}

    public static FunctionDeployer create(AwsSettings settings, DeployerProperties properties, MeterRegistry meterRegistry) {
        return FunctionDeployer.create(
                new IamIdentityService(AwsClients.iam(settings)),
                new LambdaComputeService(AwsClients.lambda(settings)),
                properties,
                meterRegistry
        );
    }
}
