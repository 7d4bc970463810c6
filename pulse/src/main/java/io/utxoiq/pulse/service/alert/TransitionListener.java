package io.utxoiq.pulse.service.alert;

import io.utxoiq.pulse.domain.alert.TransitionEvent;

/**
 * Receives transitions on the evaluating shard thread. Blocking here holds back that shard.
 */
@FunctionalInterface
public interface TransitionListener {
    void onTransition(TransitionEvent event);
}
