package com.makeitso.ledger.session;

import com.makeitso.ledger.audit.RiskLevel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/** Things the signed-in user should act on, shown alongside the session status. */
public enum SecurityAdvisory {

    PASSWORD_EXPIRING("Your password expires soon and must be changed", RiskLevel.HIGH),
    MFA_REQUIRED("Multi-factor authentication is required for administrator accounts", RiskLevel.MEDIUM),
    MFA_PENDING("Verify your second factor to raise this session's security level", RiskLevel.MEDIUM),
    SESSION_EXPIRING("Your session is about to expire due to inactivity", RiskLevel.MEDIUM);

    /** How far ahead of the rotation deadline PASSWORD_EXPIRING is raised. */
    static final Duration PASSWORD_NOTICE = Duration.ofDays(7);

    private final String    message;
    private final RiskLevel severity;

    SecurityAdvisory(String message, RiskLevel severity) {
        this.message  = message;
        this.severity = severity;
    }

    public String message() {
        return message;
    }

    public RiskLevel severity() {
        return severity;
    }

    public static List<SecurityAdvisory> evaluate(SessionSnapshot snapshot, Duration passwordRotation) {
        List<SecurityAdvisory> advisories = new ArrayList<>();
        Instant changed = snapshot.principal().passwordChangedAt();
        if (changed != null
                && !snapshot.takenAt().isBefore(changed.plus(passwordRotation).minus(PASSWORD_NOTICE))) {
            advisories.add(PASSWORD_EXPIRING);
        }
        if (snapshot.principal().isAdministrator() && !snapshot.principal().mfaEnabled()) {
            advisories.add(MFA_REQUIRED);
        }
        if (snapshot.principal().mfaEnabled() && !snapshot.mfaVerified()) {
            advisories.add(MFA_PENDING);
        }
        if (snapshot.state() == SessionState.WARNING) {
            advisories.add(SESSION_EXPIRING);
        }
        return advisories;
    }
}
