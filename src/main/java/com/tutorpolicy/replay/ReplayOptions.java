package com.tutorpolicy.replay;

import com.tutorpolicy.context.FullResetPolicy;
import com.tutorpolicy.rules.AutoEscalationMode;

import java.util.Objects;

public record ReplayOptions(AutoEscalationMode autoEscalationMode, String resetPolicyId) {

    public ReplayOptions {
        Objects.requireNonNull(autoEscalationMode, "autoEscalationMode is required");
        Objects.requireNonNull(resetPolicyId, "resetPolicyId is required");
    }

    public static ReplayOptions defaults() {
        return new ReplayOptions(AutoEscalationMode.ALWAYS_AFTER_HINT_THRESHOLD, FullResetPolicy.ID);
    }

    /** Copy with any non-null override applied. */
    public ReplayOptions with(AutoEscalationMode mode, String resetPolicy) {
        return new ReplayOptions(
            mode != null ? mode : autoEscalationMode,
            resetPolicy != null && !resetPolicy.isBlank() ? resetPolicy : resetPolicyId
        );
    }
}
