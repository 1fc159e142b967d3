package com.example.clubservice.dto;

import com.example.clubservice.entity.Member;
import com.example.clubservice.entity.Role;
import com.example.clubservice.security.AuthenticatedPrincipal;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of the authenticated identity.
 */
public record PrincipalDto(
    @JsonProperty("id")
    Long id,

    @JsonProperty("email")
    String email,

    @JsonProperty("organization_id")
    String organizationId,

    @JsonProperty("role")
    Role role
) {
    public static PrincipalDto fromMember(Member member) {
        return new PrincipalDto(member.getId(), member.getEmail(), member.getOrganizationId(), member.getRole());
    }

    public static PrincipalDto fromPrincipal(AuthenticatedPrincipal principal) {
        return new PrincipalDto(principal.id(), principal.email(), principal.organizationId(), principal.role());
    }
}
