package com.makeitso.ledger.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.makeitso.ledger.session.SessionExpiredException;
import com.makeitso.ledger.session.SessionIntegrityException;
import com.makeitso.ledger.session.SessionLifecycleMonitor;
import com.makeitso.ledger.session.TrackedSession;
import com.makeitso.ledger.web.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;

/**
 * Reads the JWT from the Authorization header on every request.
 *
 * A valid token only names a session. The session must still be live, and the
 * request itself counts as activity, except for the status poll and the explicit
 * activity endpoint, which would otherwise keep a session alive on their own.
 * A dead session gets a 401 here, before any controller runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    static final String SESSION_PATH  = "/api/session";
    static final String ACTIVITY_PATH = "/api/session/activity";

    private final JwtUtil                 jwtUtil;
    private final SessionLifecycleMonitor sessionMonitor;
    private final ObjectMapper            objectMapper;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        String header = request.getHeader("Authorization");

        if (header != null && header.startsWith("Bearer ")
                && SecurityContextHolder.getContext().getAuthentication() == null) {

            Optional<JwtUtil.TokenClaims> claims = jwtUtil.verify(header.substring(7));
            if (claims.isPresent()) {
                String sessionId = claims.get().sessionId();
                TrackedSession session;
                try {
                    session = sessionMonitor.requireLive(sessionId);
                    if (!session.principal().id().equals(claims.get().userId())) {
                        throw new SessionIntegrityException("Token subject does not own session " + sessionId);
                    }
                    if (!isPassive(request)) {
                        sessionMonitor.recordActivity(sessionId, null);
                    }
                } catch (SessionExpiredException | SessionIntegrityException e) {
                    log.debug("[JWT] Rejected session {} path={}: {}", sessionId, request.getRequestURI(), e.getMessage());
                    writeSessionExpired(request, response);
                    return;
                }

                AuthenticatedSession caller = new AuthenticatedSession(sessionId, session.principal());
                var auth = new UsernamePasswordAuthenticationToken(caller, null, caller.authorities());
                auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("[JWT] Authenticated userId={} session={} path={}",
                        caller.userId(), sessionId, request.getRequestURI());
            }
        }

        chain.doFilter(request, response);
    }

    private boolean isPassive(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return (HttpMethod.GET.matches(request.getMethod()) && SESSION_PATH.equals(path))
                || ACTIVITY_PATH.equals(path);
    }

    private void writeSessionExpired(HttpServletRequest request, HttpServletResponse response) throws IOException {
        ErrorResponse body = ErrorResponse.of(HttpStatus.UNAUTHORIZED, SessionExpiredException.MESSAGE,
                request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), body);
    }
}
