package com.makeitso.ledger.auth;

import java.util.regex.Pattern;

/** Flags user agents that look automated. Advisory only; login is not blocked. */
public final class UserAgentInspector {

    private static final Pattern AUTOMATED = Pattern.compile(
            "bot|crawler|spider|scraper|automated|test", Pattern.CASE_INSENSITIVE);

    private UserAgentInspector() {
    }

    public static boolean isSuspicious(String userAgent) {
        return userAgent == null || userAgent.isBlank() || AUTOMATED.matcher(userAgent).find();
    }
}
