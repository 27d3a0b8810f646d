package com.example.quorum.controller;

import com.example.quorum.domain.AgentRun;
import com.example.quorum.domain.MemoryContext;
import com.example.quorum.memory.SettingsService;
import com.example.quorum.scheduling.AgentCatalog;
import com.example.quorum.scheduling.AgentDefinition;
import com.example.quorum.scheduling.AgentRunService;
import com.example.quorum.scheduling.NotificationGate;
import com.example.quorum.scheduling.QuietHours;
import com.example.quorum.scheduling.TierPolicy;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.*;

/**
 * Agent catalog, run history and manual triggers.
 */
@RestController
@RequestMapping("/api/agents")
@RequiredArgsConstructor
public class AgentController {

    private final AgentCatalog catalog;
    private final AgentRunService agentRunService;
    private final SettingsService settingsService;
    private final NotificationGate notificationGate;

    @GetMapping
    public ResponseEntity<List<Map<String, Object>>> listAgents() {
        Map<String, AgentRun> latest = agentRunService.latestRuns();
        List<Map<String, Object>> agents = new ArrayList<>();
        for (AgentDefinition agent : catalog.all()) {
            agents.add(describe(agent, latest.get(agent.getName())));
        }
        return ResponseEntity.ok(agents);
    }

    @GetMapping("/{name}")
    public ResponseEntity<Map<String, Object>> getAgent(@PathVariable String name) {
        AgentDefinition agent = catalog.require(name);
        return ResponseEntity.ok(describe(agent, agentRunService.latestRuns().get(agent.getName())));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<AgentRun>> runs(@RequestParam(required = false) String agent,
                                               @RequestParam(defaultValue = "20") int limit) {
        if (agent != null && !agent.isBlank()) catalog.require(agent);
        return ResponseEntity.ok(agentRunService.recentRuns(agent, limit));
    }

    /**
     * Latest run of every agent that has run at least once.
     */
    @GetMapping("/runs/latest")
    public ResponseEntity<Map<String, AgentRun>> latestRuns() {
        return ResponseEntity.ok(agentRunService.latestRuns());
    }

    /**
     * Run an agent now, outside its schedule. Returns before the run finishes.
     */
    @PostMapping("/{name}/run")
    public ResponseEntity<Map<String, Object>> trigger(@PathVariable String name) {
        AgentDefinition agent = catalog.require(name);
        agentRunService.triggerAsync(agent.getName());
        return ResponseEntity.accepted().body(Map.of("agent", agent.getName(), "status", "triggered"));
    }

    @PutMapping("/{name}/enabled")
    public ResponseEntity<Map<String, Object>> setEnabled(@PathVariable String name,
                                                          @RequestBody Map<String, Object> body) {
        AgentDefinition agent = catalog.require(name);
        Boolean enabled = Requests.bool(body, "enabled");
        if (enabled == null) {
            throw new IllegalArgumentException("Field 'enabled' is required");
        }
        settingsService.setAgentEnabled(MemoryContext.user(), agent.getName(), enabled);
        return ResponseEntity.ok(Map.of("agent", agent.getName(), "enabled", enabled));
    }

    @GetMapping("/quiet-hours")
    public ResponseEntity<Map<String, Object>> quietHours() {
        QuietHours window = notificationGate.quietHours();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("enabled", window.enabled());
        body.put("start_hour", window.startHour());
        body.put("end_hour", window.endHour());
        body.put("zone", window.zone().getId());
        body.put("quiet_now", notificationGate.isQuietNow());
        return ResponseEntity.ok(body);
    }

    private Map<String, Object> describe(AgentDefinition agent, AgentRun lastRun) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", agent.getName());
        body.put("display_name", agent.getDisplayName());
        body.put("tier", agent.getTier());
        body.put("description", agent.getDescription());
        body.put("cron", agent.getCron());
        body.put("enabled", agentRunService.isEnabled(agent));
        body.put("writes", TierPolicy.allowed(agent.getTier()));
        body.put("last_run", lastRun);
        return body;
    }
}
