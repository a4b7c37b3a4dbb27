package it.unimib.datai.fnship.deployer.activation;

import it.unimib.datai.fnship.common.model.FunctionState;
import it.unimib.datai.fnship.common.model.FunctionStatus;
import it.unimib.datai.fnship.common.model.UpdateStatus;

/**
 * Terminal condition an {@link ActivationWaiter} polls for.
 */
public enum ActivationTarget {
    /** A freshly created function reached the ACTIVE state. */
    ACTIVE {
        @Override
        public ActivationPhase evaluate(FunctionStatus status) {
            if (status == null || status.state() == null) {
                return ActivationPhase.PENDING;
            }
            return switch (status.state()) {
                case ACTIVE -> ActivationPhase.READY;
                case FAILED -> ActivationPhase.FAILED;
                default -> ActivationPhase.PENDING;
            };
        }
    },
    /** The last code update of an existing function completed. */
    UPDATED {
        @Override
        public ActivationPhase evaluate(FunctionStatus status) {
            if (status == null) {
                return ActivationPhase.PENDING;
            }
            if (status.state() == FunctionState.FAILED || status.lastUpdateStatus() == UpdateStatus.FAILED) {
                return ActivationPhase.FAILED;
            }
            return status.lastUpdateStatus() == UpdateStatus.SUCCESSFUL
                    ? ActivationPhase.READY
                    : ActivationPhase.PENDING;
        }
    };

    public abstract ActivationPhase evaluate(FunctionStatus status);
}
