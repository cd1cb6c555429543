package com.taskboard.servicebackend.security;

import com.taskboard.servicebackend.user.AppUser;
import com.taskboard.servicebackend.user.UserService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Resolves the bearer token into an {@link AuthenticatedUser}. A rejected token leaves the request
 * unauthenticated and records the reason under {@link #FAILURE_ATTRIBUTE} for the entry point.
 */
public class JwtAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    public static final String FAILURE_ATTRIBUTE = JwtAuthenticationFilter.class.getName() + ".failure";
    public static final String NEW_TOKEN_HEADER = "X-New-Token";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final UserService userService;

    public JwtAuthenticationFilter(JwtService jwtService, UserService userService) {
        this.jwtService = jwtService;
        this.userService = userService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        TokenIdentity identity;
        try {
            identity = jwtService.verify(token);
        } catch (TokenVerificationException e) {
            log.debug("Rejected bearer token on {}: {}", request.getRequestURI(), e.getReason());
            request.setAttribute(FAILURE_ATTRIBUTE, e.getReason());
            filterChain.doFilter(request, response);
            return;
        }

        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            Optional<AppUser> user = userService.findById(identity.userId());
            if (user.isPresent()) {
                authenticateUser(user.get());
                if (jwtService.isExpiringSoon(identity)) {
                    response.setHeader(NEW_TOKEN_HEADER, jwtService.issue(user.get()));
                }
            } else {
                log.debug("Bearer token refers to unknown user {}", identity.userId());
                request.setAttribute(FAILURE_ATTRIBUTE, TokenVerificationException.Reason.INVALID);
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticateUser(AppUser user) {
        AuthenticatedUser principal = new AuthenticatedUser(
                user.getId(),
                user.getName(),
                user.getEmail()
        );
        UsernamePasswordAuthenticationToken authenticationToken =
                new UsernamePasswordAuthenticationToken(
                        principal,
                        null,
                        List.of(new SimpleGrantedAuthority("ROLE_USER"))
                );
        SecurityContextHolder.getContext().setAuthentication(authenticationToken);
    }
}
