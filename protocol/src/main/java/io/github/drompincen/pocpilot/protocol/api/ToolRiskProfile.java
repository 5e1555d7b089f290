package io.github.drompincen.pocpilot.protocol.api;

public enum ToolRiskProfile {
    READ_ONLY,
    WRITES_DOMAIN_STATE,
    EXTERNAL_SIDE_EFFECTS
}
