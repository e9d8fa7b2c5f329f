package com.pressplay.orchestration.model;

public enum AutomationJobKind {
    NEW_INSTALL,
    RECONCILE,
    OPPORTUNISTIC
}
