package com.makeitso.ledger.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static com.makeitso.ledger.support.Principals.principal;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SecurityLevelClassifier")
class SecurityLevelClassifierTest {

    @ParameterizedTest(name = "{0} mfaEnabled={1} verified={2} → {3}")
    @CsvSource({
            "STANDARD_USER, false, false, LOW",
            "STANDARD_USER, false, true,  LOW",
            "ADMINISTRATOR, false, true,  LOW",
            "STANDARD_USER, true,  false, MEDIUM",
            "ADMINISTRATOR, true,  false, MEDIUM",
            "STANDARD_USER, true,  true,  HIGH",
            "MANAGER,       true,  true,  HIGH",
            "ADMINISTRATOR, true,  true,  CRITICAL"
    })
    void classifies(Role role, boolean mfaEnabled, boolean verified, SecurityLevel expected) {
        assertThat(SecurityLevelClassifier.classify(principal(1, role, mfaEnabled), verified)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Every combination yields exactly one level")
    void exhaustive() {
        for (Role role : Role.values()) {
            for (boolean enabled : new boolean[]{false, true}) {
                for (boolean verified : new boolean[]{false, true}) {
                    assertThat(SecurityLevelClassifier.classify(principal(1, role, enabled), verified)).isNotNull();
                }
            }
        }
    }

    @Test
    @DisplayName("Password expiry is a closed bound and a missing change date counts as expired")
    void passwordExpiry() {
        Principal user = principal(1, Role.STANDARD_USER, false);
        Duration rotation = Duration.ofDays(90);
        Instant deadline = user.passwordChangedAt().plus(rotation);

        assertThat(user.isPasswordExpired(deadline.minusSeconds(1), rotation)).isFalse();
        assertThat(user.isPasswordExpired(deadline, rotation)).isTrue();
        assertThat(new Principal(2L, "x@example.com", Role.READ_ONLY, null, AccountStatus.ACTIVE, false, null)
                .isPasswordExpired(deadline, rotation)).isTrue();
    }
}
