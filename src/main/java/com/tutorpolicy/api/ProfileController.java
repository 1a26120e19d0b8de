package com.tutorpolicy.api;

import com.tutorpolicy.contract.LearnerProfile;
import com.tutorpolicy.engine.PolicyEngineService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET/PUT /v1/profiles/{learnerId}
 */
@RestController
@RequestMapping("/v1/profiles")
public class ProfileController {

    private final PolicyEngineService engineService;

    public ProfileController(PolicyEngineService engineService) {
        this.engineService = engineService;
    }

    @GetMapping("/{learnerId}")
    public LearnerProfile get(@PathVariable String learnerId) {
        return engineService.profile(learnerId);
    }

    @PutMapping("/{learnerId}")
    public LearnerProfile put(@PathVariable String learnerId, @RequestBody LearnerProfile profile) {
        if (profile.id() != null && !profile.id().equals(learnerId)) {
            throw new IllegalArgumentException("profile id does not match path: " + profile.id());
        }
        return engineService.saveProfile(
            new LearnerProfile(learnerId, profile.currentStrategy(), profile.preferences()));
    }
}
