package com.makeitso.ledger.auth;

import com.makeitso.ledger.auth.dto.AuthResponse;
import com.makeitso.ledger.auth.dto.ChangePasswordRequest;
import com.makeitso.ledger.auth.dto.LoginRequest;
import com.makeitso.ledger.auth.dto.MfaResponse;
import com.makeitso.ledger.auth.dto.MfaVerifyRequest;
import com.makeitso.ledger.auth.dto.RegisterRequest;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints:
 *   POST /api/auth/register    create a StandardUser account
 *   POST /api/auth/login       email + password → bearer token bound to a new session
 *   POST /api/auth/logout      end the caller's session
 *   POST /api/auth/mfa/verify  second-factor code for the caller's session
 *   POST /api/auth/password    rotate the password (works while it is expired)
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request,
                                              HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientInfo.from(httpRequest)));
    }

    @PostMapping("/logout")
    public ResponseEntity<Void> logout(@AuthenticationPrincipal AuthenticatedSession caller) {
        authService.logout(caller);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/mfa/verify")
    public ResponseEntity<MfaResponse> verifyMfa(@AuthenticationPrincipal AuthenticatedSession caller,
                                                 @Valid @RequestBody MfaVerifyRequest request) {
        return ResponseEntity.ok(authService.verifyMfa(caller, request.code()));
    }

    @PostMapping("/password")
    public ResponseEntity<Void> changePassword(@Valid @RequestBody ChangePasswordRequest request,
                                               HttpServletRequest httpRequest) {
        authService.changePassword(request, ClientInfo.from(httpRequest));
        return ResponseEntity.noContent().build();
    }
}
