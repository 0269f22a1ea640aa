package com.enterpriseagent.core.graph;

import com.enterpriseagent.core.state.RunState;

import java.util.Map;

/**
 * A graph node: reads the current state and returns the fields it changes.
 */
@FunctionalInterface
public interface NodeAction {

    Map<String, Object> apply(RunState state) throws Exception;
}
