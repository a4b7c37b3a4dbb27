package it.unimib.datai.fnship.deployer.lifecycle;

import it.unimib.datai.fnship.common.model.DeployOptions;
import it.unimib.datai.fnship.common.model.FunctionArtifact;
import it.unimib.datai.fnship.common.model.FunctionState;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.deployer.activation.ActivationWaiter;
import it.unimib.datai.fnship.deployer.config.DeployerProperties;
import it.unimib.datai.fnship.deployer.error.DeploymentTimeoutException;
import it.unimib.datai.fnship.deployer.error.InvalidInputException;
import it.unimib.datai.fnship.deployer.error.RemoteFailureException;
import it.unimib.datai.fnship.deployer.identity.RoleResolver;
import it.unimib.datai.fnship.deployer.testsupport.FakeComputeService;
import it.unimib.datai.fnship.deployer.testsupport.FakeIdentityService;
import it.unimib.datai.fnship.deployer.testsupport.ImmediateScheduler;
import it.unimib.datai.fnship.deployer.testsupport.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeploymentManagerTest {
    private static final String SOURCE = "exports.handler = async (event) => event;";

    private FakeIdentityService identity;
    private FakeComputeService compute;
    private DeploymentManager manager;

    @BeforeEach
    void setUp() {
        ManualClock clock = new ManualClock();
        identity = new FakeIdentityService();
        compute = new FakeComputeService();
        DeployerProperties properties = DeployerProperties.defaults()
                .withActivationTimeout(Duration.ofSeconds(30));
        manager = new DeploymentManager(new RoleResolver(identity), compute,
                new ActivationWaiter(clock, new ImmediateScheduler(clock), Duration.ofSeconds(1)), properties);
    }

    @Test
    void deploy_newRoleAndPendingPolls_returnsCreatedArnAfterActive() {
        compute.statuses(FunctionStatus.of(FunctionState.PENDING),
                FunctionStatus.of(FunctionState.PENDING),
                FunctionStatus.of(FunctionState.ACTIVE));

        String arn = manager.deploy("f1", SOURCE, DeployOptions.defaults()).join();

        assertThat(arn).isEqualTo(FakeComputeService.ARN_PREFIX + "f1");
        assertThat(identity.calls).containsExactly(
                "find:fnship-lambda-role", "create:fnship-lambda-role", "attach:fnship-lambda-role");
        assertThat(identity.policiesOf("fnship-lambda-role"))
                .containsExactly(DeployerProperties.LAMBDA_BASIC_EXECUTION_POLICY);
        assertThat(compute.calls).filteredOn(c -> c.startsWith("create:")).containsExactly("create:f1");
        assertThat(compute.polls).isEqualTo(3);
        assertThat(compute.lastRoleArn).isEqualTo(FakeIdentityService.ARN_PREFIX + "fnship-lambda-role");
    }

    @Test
    void deploy_defaultsAppliedToArtifactConfiguration() {
        compute.statuses(FunctionStatus.of(FunctionState.ACTIVE));

        manager.deploy("f1", SOURCE, null).join();

        FunctionArtifact artifact = compute.artifacts.get(0);
        assertThat(artifact.entryName()).isEqualTo("index.js");
        assertThat(artifact.configuration().runtime()).isEqualTo("nodejs18.x");
        assertThat(artifact.configuration().handler()).isEqualTo("index.handler");
        assertThat(artifact.configuration().timeoutSeconds()).isEqualTo(10);
        assertThat(artifact.configuration().memorySizeMb()).isEqualTo(128);
    }

    @Test
    void deploy_customRole_usedInsteadOfDefault() {
        identity.withRole("custom-role");
        compute.statuses(FunctionStatus.of(FunctionState.ACTIVE));

        manager.deploy("f1", SOURCE, DeployOptions.defaults().withRoleName("custom-role")).join();

        assertThat(identity.calls).containsExactly("find:custom-role");
        assertThat(compute.lastRoleArn).isEqualTo(FakeIdentityService.ARN_PREFIX + "custom-role");
    }

    @Test
    void deploy_secondDeploySameRole_takesFastPath() {
        compute.statuses(FunctionStatus.of(FunctionState.ACTIVE));

        manager.deploy("f1", SOURCE, null).join();
        manager.deploy("f2", SOURCE, null).join();

        assertThat(identity.calls).filteredOn(c -> c.startsWith("create:")).hasSize(1);
    }

    @Test
    void deploy_neverActive_deploymentTimeout() {
        compute.statuses(FunctionStatus.of(FunctionState.PENDING));

        assertThatThrownBy(() -> manager.deploy("f1", SOURCE, null).join())
                .isInstanceOf(CompletionException.class)
                .cause()
                .isInstanceOf(DeploymentTimeoutException.class)
                .hasMessage("deploy(f1) failed: function not active after 30s");
    }

    @Test
    void deploy_failedState_remoteFailure() {
        compute.statuses(new FunctionStatus(FunctionState.FAILED, null, "bad handler"));

        assertThatThrownBy(() -> manager.deploy("f1", SOURCE, null).join())
                .cause()
                .isInstanceOf(RemoteFailureException.class)
                .hasMessageStartingWith("deploy(f1) failed:")
                .hasMessageContaining("bad handler");
    }

    @Test
    void deploy_createFails_remoteFailureAndRoleKept() {
        compute.createResult = CompletableFuture.failedFuture(new IllegalStateException("quota exceeded"));

        assertThatThrownBy(() -> manager.deploy("f1", SOURCE, null).join())
                .cause()
                .isInstanceOf(RemoteFailureException.class)
                .hasMessage("deploy(f1) failed: quota exceeded");
        assertThat(identity.hasRole("fnship-lambda-role")).isTrue();
        assertThat(compute.polls).isZero();
    }

    @Test
    void deploy_roleLookupFails_remoteFailureWithoutCreatingRole() {
        identity.findFailure = new IllegalStateException("AccessDenied");

        assertThatThrownBy(() -> manager.deploy("f1", SOURCE, null).join())
                .cause()
                .isInstanceOf(RemoteFailureException.class)
                .hasMessage("deploy(f1) failed: AccessDenied")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(identity.calls).containsExactly("find:fnship-lambda-role");
        assertThat(compute.calls).isEmpty();
    }

    @Test
    void deploy_roleResolverThrows_failedFutureInsteadOfThrow() {
        RoleResolver throwing = mock(RoleResolver.class);
        when(throwing.ensureRole(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("client closed"));
        ManualClock clock = new ManualClock();
        DeploymentManager withThrowingResolver = new DeploymentManager(throwing, compute,
                new ActivationWaiter(clock, new ImmediateScheduler(clock), Duration.ofSeconds(1)),
                DeployerProperties.defaults());

        CompletableFuture<String> result = withThrowingResolver.deploy("f1", SOURCE, null);

        assertThatThrownBy(result::join)
                .cause()
                .isInstanceOf(RemoteFailureException.class)
                .hasMessage("deploy(f1) failed: client closed");
        assertThat(compute.calls).isEmpty();
    }

    @Test
    void deploy_emptyCode_rejectedBeforeAnyRemoteCall() {
        assertThatThrownBy(() -> manager.deploy("f1", "", null).join())
                .cause()
                .isInstanceOf(InvalidInputException.class);
        assertThat(identity.calls).isEmpty();
        assertThat(compute.calls).isEmpty();
    }

    @Test
    void deploy_blankName_rejected() {
        assertThatThrownBy(() -> manager.deploy(" ", SOURCE, null).join())
                .cause()
                .isInstanceOf(InvalidInputException.class);
        assertThat(identity.calls).isEmpty();
    }

    @Test
    void deploy_invalidMemory_rejected() {
        DeployOptions options = new DeployOptions(null, null, null, 0, null, null);

        assertThatThrownBy(() -> manager.deploy("f1", SOURCE, options).join())
                .cause()
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("memorySize");
    }
}
