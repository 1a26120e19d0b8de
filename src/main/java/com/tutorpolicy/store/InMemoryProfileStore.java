package com.tutorpolicy.store;

import com.tutorpolicy.contract.LearnerProfile;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryProfileStore implements ProfileStore {

    private final ConcurrentHashMap<String, LearnerProfile> profiles = new ConcurrentHashMap<>();

    @Override
    public Optional<LearnerProfile> getProfile(String learnerId) {
        return learnerId == null ? Optional.empty() : Optional.ofNullable(profiles.get(learnerId));
    }

    @Override
    public LearnerProfile save(LearnerProfile profile) {
        if (profile == null || profile.id() == null || profile.id().isBlank()) {
            throw new IllegalArgumentException("profile id is required");
        }
        profiles.put(profile.id(), profile);
        return profile;
    }
}
