package io.github.drompincen.pocpilot.runtime.tools;

import io.github.drompincen.pocpilot.runtime.security.CallerIdentity;

/** Who a tool runs as. A tool never sees more than this caller could. */
public record ToolContext(
        CallerIdentity caller,
        String sessionId
) {}
