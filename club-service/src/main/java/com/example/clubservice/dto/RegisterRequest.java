package com.example.clubservice.dto;

import com.example.clubservice.entity.Role;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.*;

/**
 * Registration request DTO.
 *
 * Validation Rules:
 * - organization_id: required, the organization the member joins
 * - email: valid format, max 255 chars, unique
 * - password: 8-100 chars
 * - first_name / last_name: 1-100 chars
 * - role: admin, coach or member
 */
public record RegisterRequest(
    @JsonProperty("organization_id")
    @NotBlank(message = "Organization is required")
    @Size(max = 64, message = "Organization id must not exceed 64 characters")
    String organizationId,

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email format")
    @Size(max = 255, message = "Email must not exceed 255 characters")
    String email,

    @NotBlank(message = "Password is required")
    @Size(min = 8, max = 100, message = "Password must be 8-100 characters")
    String password,

    @JsonProperty("first_name")
    @NotBlank(message = "First name is required")
    @Size(max = 100, message = "First name must not exceed 100 characters")
    String firstName,

    @JsonProperty("last_name")
    @NotBlank(message = "Last name is required")
    @Size(max = 100, message = "Last name must not exceed 100 characters")
    String lastName,

    @NotNull(message = "Role is required")
    Role role
) {
}
