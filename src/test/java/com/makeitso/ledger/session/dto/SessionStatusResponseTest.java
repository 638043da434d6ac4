package com.makeitso.ledger.session.dto;

import com.makeitso.ledger.config.SecurityPolicyProperties;
import com.makeitso.ledger.security.Principal;
import com.makeitso.ledger.security.Role;
import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.session.SecurityAdvisory;
import com.makeitso.ledger.session.SessionSnapshot;
import com.makeitso.ledger.session.SessionState;
import com.makeitso.ledger.support.Principals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SessionStatusResponse")
class SessionStatusResponseTest {

    @ParameterizedTest
    @CsvSource({
            "0,       0:00",
            "5000,    0:05",
            "59999,   0:59",
            "245000,  4:05",
            "1800000, 30:00",
            "-1000,   0:00"
    })
    @DisplayName("Countdown is minutes and zero-padded seconds")
    void formatsCountdown(long millis, String expected) {
        assertThat(SessionStatusResponse.formatRemaining(Duration.ofMillis(millis))).isEqualTo(expected);
    }

    @Test
    @DisplayName("Warning snapshot maps to a flagged response with its subscription path")
    void fromWarningSnapshot() {
        Principal principal = Principals.principal(3, Role.MANAGER, true);
        Instant at = Principals.T0.plus(Duration.ofDays(1));
        SessionSnapshot snapshot = new SessionSnapshot("s-3", principal, SessionState.WARNING, SecurityLevel.MEDIUM,
                SecurityPolicyProperties.defaults().policyFor(SecurityLevel.MEDIUM),
                at.minus(Duration.ofMinutes(40)), at.minus(Duration.ofMinutes(26)), false,
                Duration.ofMinutes(4), at);

        SessionStatusResponse response = SessionStatusResponse.from(snapshot,
                List.of(SecurityAdvisory.MFA_PENDING, SecurityAdvisory.SESSION_EXPIRING));

        assertThat(response.warning()).isTrue();
        assertThat(response.requiresMfa()).isTrue();
        assertThat(response.timeUntilTimeoutMs()).isEqualTo(240_000L);
        assertThat(response.timeUntilTimeout()).isEqualTo("4:00");
        assertThat(response.wsSubscribePath()).isEqualTo("/topic/session/s-3");
        assertThat(response.advisories()).extracting(SessionStatusResponse.AdvisoryView::type)
                .containsExactly("MFA_PENDING", "SESSION_EXPIRING");
    }
}
