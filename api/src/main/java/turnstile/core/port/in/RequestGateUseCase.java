package turnstile.core.port.in;

import io.smallrye.mutiny.Uni;

import turnstile.core.model.gate.GateDecision;
import turnstile.core.model.gate.GateRequest;

/**
 * Inbound port for gating a single request.
 */
public interface RequestGateUseCase {

    /**
     * Decide whether a request may proceed and where to.
     *
     * <p>The returned {@link Uni} never fails: store outages surface as
     * {@link GateDecision.Unavailable} or as an anonymous caller.
     */
    Uni<GateDecision> evaluate(GateRequest request);
}
