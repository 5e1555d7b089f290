package io.github.drompincen.pocpilot.runtime.session;

import java.security.SecureRandom;
import java.util.Base64;

public final class SessionIds {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private SessionIds() {}

    /** 256 random bits, URL-safe. */
    static String next() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /** Session ids are bearer-like secrets; logs only get a prefix. */
    public static String abbreviate(String sessionId) {
        if (sessionId == null) return "null";
        return sessionId.length() <= 8 ? sessionId : sessionId.substring(0, 8) + "…";
    }
}
