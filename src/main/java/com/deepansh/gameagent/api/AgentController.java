package com.deepansh.gameagent.api;

import com.deepansh.gameagent.core.AgentLauncher;
import com.deepansh.gameagent.core.GameAgent;
import com.deepansh.gameagent.model.AgentStatus;
import com.deepansh.gameagent.model.GameStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Operational endpoints for the running agent.
 *
 * GET  /api/agent/status  phase, correlation ids, clues
 * GET  /api/agent/stats   aggregate game statistics
 * POST /api/agent/start   connect (409 if already running or stopped)
 * POST /api/agent/stop    close the agent for good
 */
@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final GameAgent agent;
    private final AgentLauncher launcher;

    @GetMapping("/status")
    public ResponseEntity<AgentStatus> status() {
        return ResponseEntity.ok(agent.getStatus());
    }

    @GetMapping("/stats")
    public ResponseEntity<GameStats> stats() {
        return ResponseEntity.ok(agent.getStats());
    }

    @PostMapping("/start")
    public ResponseEntity<Map<String, String>> start() {
        log.info("Start requested [phase={}]", agent.getPhase());
        launcher.launch();
        return ResponseEntity.accepted().body(Map.of("status", "STARTING"));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        log.info("Stop requested [phase={}]", agent.getPhase());
        launcher.stop();
        return ResponseEntity.ok(Map.of("status", "STOPPED"));
    }
}
