package com.makeitso.ledger.config;

import com.makeitso.ledger.security.SecurityLevel;
import com.makeitso.ledger.security.SecurityLevelPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - MySQL: attempts to open a real JDBC connection and queries server version
 *   - Session policy: the effective per-level table after configuration overrides
 *   - Runtime: Java version, server port
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource               dataSource;
    private final SecurityPolicyProperties policy;
    private final Environment              env;

    @Override
    public void run(ApplicationArguments args) {
        String dbStatus    = probeDatabase();
        String port        = env.getProperty("server.port", "8080");
        String javaVersion = System.getProperty("java.version");

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║           Ledger Security  —  Startup Summary            ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database (MySQL)                                        ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Session policy                                          ║
                ║    Warning        : {} min before expiry
                ║    Check interval : {} ms
                ║    Password age   : {} days
                ║    {}
                ║    {}
                ║    {}
                ║    {}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                javaVersion,

                dbStatus,

                policy.warningMinutes(),
                policy.checkIntervalMs(),
                policy.passwordRotationDays(),
                describe(SecurityLevel.LOW),
                describe(SecurityLevel.MEDIUM),
                describe(SecurityLevel.HIGH),
                describe(SecurityLevel.CRITICAL)
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String describe(SecurityLevel level) {
        SecurityLevelPolicy p = policy.policyFor(level);
        return String.format("%-8s timeout=%dm mfa=%s concurrent=%s lockout=%d×/%dm",
                level, p.sessionTimeoutMinutes(), p.requiresMfa() ? "✔" : "✘",
                p.allowConcurrentSessions() ? "✔" : "✘", p.maxFailedAttempts(), p.lockoutDurationMinutes());
    }

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (SQLException e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }
}
