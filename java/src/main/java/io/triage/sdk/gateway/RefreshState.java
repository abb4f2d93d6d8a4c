package io.triage.sdk.gateway;

public enum RefreshState {
    IDLE,
    REFRESHING
}
