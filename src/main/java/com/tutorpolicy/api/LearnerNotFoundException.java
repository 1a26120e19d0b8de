package com.tutorpolicy.api;

public class LearnerNotFoundException extends RuntimeException {

    public LearnerNotFoundException(String learnerId) {
        super("no profile for learner: " + learnerId);
    }
}
