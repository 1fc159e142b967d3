package com.example.clubservice.controller;

import com.example.clubservice.dto.LoginRequest;
import com.example.clubservice.dto.LoginResponse;
import com.example.clubservice.dto.MessageResponse;
import com.example.clubservice.dto.PrincipalDto;
import com.example.clubservice.dto.RefreshTokenRequest;
import com.example.clubservice.dto.RegisterRequest;
import com.example.clubservice.security.ClientInfo;
import com.example.clubservice.service.AuthService;
import com.example.clubservice.service.RefreshTokenService;
import com.example.clubservice.tenant.TenantScopedRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Authentication controller.
 *
 * login / refresh / register are public; logout and me need a bearer token.
 */
@RestController
@RequestMapping("/api/auth")
@Tag(name = "Auth", description = "Credential lifecycle")
public class AuthController {

    private final AuthService authService;
    private final RefreshTokenService refreshTokenService;

    public AuthController(AuthService authService, RefreshTokenService refreshTokenService) {
        this.authService = authService;
        this.refreshTokenService = refreshTokenService;
    }

    /**
     * POST /api/auth/register
     *
     * @return 201 Created with a token pair
     * @throws com.example.clubservice.exception.EmailAlreadyExistsException 409 Conflict
     */
    @Operation(summary = "Register a member", responses = {
            @ApiResponse(responseCode = "201", description = "Member created"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping("/register")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request,
                                                  HttpServletRequest httpRequest) {
        LoginResponse response = authService.register(request, ClientInfo.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * POST /api/auth/login
     *
     * @return 200 OK with a token pair
     * @throws com.example.clubservice.exception.InvalidCredentialsException 401 Unauthorized
     */
    @Operation(summary = "Log in with email and password", responses = {
            @ApiResponse(responseCode = "200", description = "Token pair issued"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request,
                                               HttpServletRequest httpRequest) {
        return ResponseEntity.ok(authService.login(request, ClientInfo.from(httpRequest)));
    }

    /**
     * POST /api/auth/refresh
     *
     * The presented refresh token is consumed; replaying it fails.
     */
    @Operation(summary = "Rotate a refresh token", responses = {
            @ApiResponse(responseCode = "200", description = "New token pair issued"),
            @ApiResponse(responseCode = "401", description = "Invalid, revoked or expired refresh token")
    })
    @PostMapping("/refresh")
    public ResponseEntity<LoginResponse> refresh(@Valid @RequestBody RefreshTokenRequest request,
                                                 HttpServletRequest httpRequest) {
        return ResponseEntity.ok(refreshTokenService.refreshToken(request.refreshToken(), ClientInfo.from(httpRequest)));
    }

    /**
     * POST /api/auth/logout
     *
     * Revokes every refresh token of the caller. Idempotent.
     */
    @Operation(summary = "Log out everywhere")
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(TenantScopedRequest tenant) {
        authService.logout(tenant.principal().id());
        return ResponseEntity.ok(MessageResponse.of("Logged out successfully"));
    }

    @Operation(summary = "Current principal")
    @GetMapping("/me")
    public ResponseEntity<PrincipalDto> me(TenantScopedRequest tenant) {
        return ResponseEntity.ok(PrincipalDto.fromPrincipal(tenant.principal()));
    }
}
