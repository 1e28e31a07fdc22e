package com.agentexec.recovery.session;

import com.agentexec.core.model.Step;

import java.util.Map;

/**
 * Work performed by a step. The returned map becomes the step's output.
 */
@FunctionalInterface
public interface StepAction {

    Map<String, Object> run(Step step) throws Exception;
}
