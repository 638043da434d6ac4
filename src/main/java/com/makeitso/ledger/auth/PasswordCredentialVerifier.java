package com.makeitso.ledger.auth;

import com.makeitso.ledger.domain.User;
import com.makeitso.ledger.repository.UserRepository;
import com.makeitso.ledger.security.Principal;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** BCrypt check against the users table. */
@Component
public class PasswordCredentialVerifier implements CredentialVerifier {

    private final UserRepository  userRepository;
    private final PasswordEncoder passwordEncoder;
    // compared against for unknown emails so both paths cost one hash
    private final String          unknownUserHash;

    public PasswordCredentialVerifier(UserRepository userRepository, PasswordEncoder passwordEncoder) {
        this.userRepository  = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.unknownUserHash = passwordEncoder.encode("unknown-user-placeholder");
    }

    @Override
    public Principal verifyCredentials(String email, String password) {
        if (email == null || password == null) {
            return null;
        }
        Optional<User> user = userRepository.findByEmail(email);
        if (user.isEmpty()) {
            passwordEncoder.matches(password, unknownUserHash);
            return null;
        }
        return passwordEncoder.matches(password, user.get().getPasswordHash())
                ? user.get().toPrincipal()
                : null;
    }
}
