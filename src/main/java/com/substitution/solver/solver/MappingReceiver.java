package com.substitution.solver.solver;

import com.substitution.solver.model.LetterMapping;

/**
 * Anything in the chain that accepts partial mappings: word stages and the
 * terminal aggregator. Delivery is synchronous; when {@code receive} returns,
 * every downstream effect of the mapping has completed.
 */
@FunctionalInterface
public interface MappingReceiver {

    void receive(LetterMapping mapping);
}
