package com.tutorpolicy.contract;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LearnerProfileTest {

    private final JsonMapper mapper = JsonMapper.builder().findAndAddModules().build();

    @Test
    void emptyPreferencesObject_fallsBackToDefaults() throws Exception {
        LearnerProfile profile = mapper.readValue(
            "{\"id\":\"learner-1\",\"current_strategy\":\"adaptive-low\",\"preferences\":{}}", LearnerProfile.class);

        assertEquals(LearnerProfile.Preferences.defaults(), profile.preferences());
        assertEquals(3, profile.preferences().escalationThreshold());
        assertEquals(300000L, profile.preferences().aggregationDelay());
    }

    @Test
    void partialPreferences_keepGivenValues() throws Exception {
        LearnerProfile profile = mapper.readValue(
            "{\"id\":\"learner-1\",\"current_strategy\":\"adaptive-low\",\"preferences\":{\"escalation_threshold\":5}}",
            LearnerProfile.class);

        assertEquals(5, profile.preferences().escalationThreshold());
        assertEquals(300000L, profile.preferences().aggregationDelay());
    }

    @Test
    void missingPreferences_useDefaults() {
        LearnerProfile profile = new LearnerProfile("learner-1", "hint-only", null);
        assertEquals(LearnerProfile.Preferences.defaults(), profile.preferences());
    }
}
