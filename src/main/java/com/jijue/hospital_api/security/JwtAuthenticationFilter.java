package com.jijue.hospital_api.security;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Authenticates requests carrying a bearer token. A bad token never fails the
 * request here; the reason is left on the request for the entry point, which
 * answers 401 only if the route turns out to need authentication.
 */
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String ERROR_ATTRIBUTE = "jwt.error";

    private static final Logger filterLogger = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtService jwtService;
    private final UserDetailsService userDetailsService;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {

        final String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith("Bearer ")) {
            filterChain.doFilter(request, response);
            return;
        }

        final String jwt = authHeader.substring(7).trim();

        try {
            final String username = jwtService.extractUsername(jwt);

            if (username != null && SecurityContextHolder.getContext().getAuthentication() == null) {
                UserDetails userDetails = this.userDetailsService.loadUserByUsername(username);

                if (!userDetails.isEnabled()) {
                    request.setAttribute(ERROR_ATTRIBUTE, "Account is deactivated. Please contact administration.");
                    filterLogger.warn("Token presented for deactivated account '{}'.", username);
                } else if (jwtService.isTokenValid(jwt, userDetails)) {
                    UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                            userDetails,
                            null,
                            userDetails.getAuthorities()
                    );
                    authToken.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContextHolder.getContext().setAuthentication(authToken);
                    filterLogger.debug("User '{}' authenticated successfully via JWT.", username);
                } else {
                    request.setAttribute(ERROR_ATTRIBUTE, "Invalid token");
                    filterLogger.warn("JWT token validation failed for user '{}'.", username);
                }
            }
        } catch (ExpiredJwtException e) {
            request.setAttribute(ERROR_ATTRIBUTE, "Token has expired. Please login again.");
            filterLogger.warn("JWT token has expired: {}", e.getMessage());
        } catch (UsernameNotFoundException e) {
            request.setAttribute(ERROR_ATTRIBUTE, "User no longer exists");
            filterLogger.warn("JWT subject no longer exists: {}", e.getMessage());
        } catch (JwtException | IllegalArgumentException e) {
            request.setAttribute(ERROR_ATTRIBUTE, "Invalid token");
            filterLogger.error("JWT token rejected: {}", e.getMessage());
        }

        filterChain.doFilter(request, response);
    }
}
