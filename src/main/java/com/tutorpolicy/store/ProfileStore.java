package com.tutorpolicy.store;

import com.tutorpolicy.contract.LearnerProfile;

import java.util.Optional;

public interface ProfileStore {

    Optional<LearnerProfile> getProfile(String learnerId);

    LearnerProfile save(LearnerProfile profile);
}
