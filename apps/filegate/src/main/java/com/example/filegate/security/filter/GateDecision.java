package com.example.filegate.security.filter;

public enum GateDecision {
    SERVE,
    NOT_FOUND,
    SERVICE_UNAVAILABLE,
    PASS_THROUGH
}
