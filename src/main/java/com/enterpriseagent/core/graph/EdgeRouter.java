package com.enterpriseagent.core.graph;

import com.enterpriseagent.core.state.RunState;

/**
 * Conditional edge: picks the next node name from the state a node just produced.
 */
@FunctionalInterface
public interface EdgeRouter {

    String route(RunState state);
}
