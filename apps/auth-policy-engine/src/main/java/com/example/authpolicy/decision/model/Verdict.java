package com.example.authpolicy.decision.model;

public enum Verdict {
    ACCEPT,
    REJECT,
    STEP_UP_REQUIRED
}
