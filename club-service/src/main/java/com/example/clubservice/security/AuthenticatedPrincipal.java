package com.example.clubservice.security;

import com.example.clubservice.entity.Role;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.List;
import java.util.Objects;

/**
 * Verified identity attached to an authenticated request.
 *
 * Built only from a verified access token, never from request body or query.
 * Immutable for the lifetime of the request.
 */
public record AuthenticatedPrincipal(
        Long id,
        String organizationId,
        Role role,
        String email
) {
    public AuthenticatedPrincipal {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(role, "role");
    }

    public List<GrantedAuthority> authorities() {
        return List.of(new SimpleGrantedAuthority(role.authority()));
    }
}
