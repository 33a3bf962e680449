package com.substitution.solver.config;

/**
 * Order in which cipher word stages are evaluated. Affects search cost only,
 * never the resolved key.
 */
public enum ChainOrdering {
    /**
     * Words with the fewest candidates are evaluated first; the widest word sits
     * next to the aggregator where most of its candidates are already ruled out.
     */
    FEWEST_CANDIDATES_FIRST,

    /**
     * Words are evaluated in the order they appear in the ciphertext.
     */
    INPUT_ORDER
}
