package com.tutorpolicy.api;

import com.tutorpolicy.contract.InteractionEvent;
import com.tutorpolicy.engine.PolicyEngineService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1/events")
public class EventController {

    private final PolicyEngineService engineService;

    public EventController(PolicyEngineService engineService) {
        this.engineService = engineService;
    }

    @PostMapping
    public Map<String, Object> record(@RequestBody InteractionEvent event) {
        InteractionEvent stored = engineService.record(event);
        return Map.of(
            "status", "accepted",
            "event_id", stored.id()
        );
    }

    @GetMapping
    public List<InteractionEvent> traceSlice(@RequestParam String learnerId,
                                             @RequestParam(required = false) String problemId,
                                             @RequestParam(required = false) Integer limit) {
        return engineService.traceSlice(learnerId, problemId, limit);
    }
}
