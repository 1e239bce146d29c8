package com.dashforge.orchestrator.api;

import com.dashforge.orchestrator.api.dto.ModelResponse;
import com.dashforge.orchestrator.service.TaskService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * GET /api/models - selectable model backends, as {"models": [...]}
 * GET /api/health - liveness for the frontend; Actuator's /actuator/health
 *                   carries the detailed view
 */
@RestController
@RequestMapping("/api")
public class SystemController {

    private final TaskService taskService;

    public SystemController(TaskService taskService) {
        this.taskService = taskService;
    }

    @GetMapping("/models")
    public Map<String, List<ModelResponse>> models() {
        return Map.of("models", taskService.availableModels().stream()
                .map(ModelResponse::from)
                .toList());
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }
}
