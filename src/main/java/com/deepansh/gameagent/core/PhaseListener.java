package com.deepansh.gameagent.core;

import com.deepansh.gameagent.model.AgentPhase;

@FunctionalInterface
public interface PhaseListener {

    /** Called after every effective phase change, on the thread that made it. */
    void onTransition(AgentPhase from, AgentPhase to);
}
