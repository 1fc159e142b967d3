package com.example.clubservice.service;

import com.example.clubservice.audit.AuditRecorder;
import com.example.clubservice.dto.LoginRequest;
import com.example.clubservice.dto.LoginResponse;
import com.example.clubservice.dto.PrincipalDto;
import com.example.clubservice.dto.RegisterRequest;
import com.example.clubservice.entity.Member;
import com.example.clubservice.entity.MemberStatus;
import com.example.clubservice.exception.EmailAlreadyExistsException;
import com.example.clubservice.exception.InvalidCredentialsException;
import com.example.clubservice.repository.MemberRepository;
import com.example.clubservice.security.ClientInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Authentication service: login, registration and logout.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final MemberRepository memberRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final RefreshTokenService refreshTokenService;
    private final AuditRecorder auditRecorder;

    public AuthService(
            MemberRepository memberRepository,
            PasswordEncoder passwordEncoder,
            JwtService jwtService,
            RefreshTokenService refreshTokenService,
            AuditRecorder auditRecorder) {
        this.memberRepository = memberRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.refreshTokenService = refreshTokenService;
        this.auditRecorder = auditRecorder;
    }

    /**
     * Register a new ACTIVE member and return a token pair.
     *
     * @throws EmailAlreadyExistsException if email already registered (409)
     */
    @Transactional
    public LoginResponse register(RegisterRequest request, ClientInfo client) {
        Member member = new Member();
        member.setOrganizationId(request.organizationId());
        member.setEmail(request.email());
        member.setPasswordHash(passwordEncoder.encode(request.password()));
        member.setFirstName(request.firstName());
        member.setLastName(request.lastName());
        member.setRole(request.role());
        member.setStatus(MemberStatus.ACTIVE);

        // DB UNIQUE constraint handles the race between two registrations
        try {
            member = memberRepository.saveAndFlush(member);
        } catch (DataIntegrityViolationException ex) {
            throw new EmailAlreadyExistsException();
        }

        log.info("Member {} registered in organization {}", member.getId(), member.getOrganizationId());
        auditRecorder.recordMemberCreated(member, client);

        return issueTokenPair(member, client);
    }

    /**
     * Authenticate a member and return a token pair.
     *
     * Password is verified BEFORE the status check; unknown email, wrong password and
     * inactive account all end in the same InvalidCredentialsException.
     *
     * @throws InvalidCredentialsException on any authentication failure (401)
     */
    @Transactional
    public LoginResponse login(LoginRequest request, ClientInfo client) {
        Optional<Member> found = memberRepository.findByEmail(request.email());
        if (found.isEmpty()) {
            // No organization to attribute an audit entry to
            log.warn("Login failed: unknown email from {}", client.ipAddress());
            throw new InvalidCredentialsException();
        }

        Member member = found.get();
        if (!passwordEncoder.matches(request.password(), member.getPasswordHash())) {
            log.warn("Login failed for member {}: invalid password", member.getId());
            auditRecorder.recordFailedLogin(member, client, "Invalid password");
            throw new InvalidCredentialsException();
        }

        if (!member.isActive()) {
            log.warn("Login failed for member {}: status {}", member.getId(), member.getStatus());
            auditRecorder.recordFailedLogin(member, client, "Account is " + member.getStatus().name().toLowerCase());
            throw new InvalidCredentialsException();
        }

        member.markLoggedIn();
        memberRepository.save(member);

        auditRecorder.recordLogin(member, client);

        return issueTokenPair(member, client);
    }

    /**
     * Revoke every refresh token of the member. Access tokens expire on their own.
     */
    @Transactional
    public void logout(Long memberId) {
        refreshTokenService.revokeAllTokens(memberId);
    }

    private LoginResponse issueTokenPair(Member member, ClientInfo client) {
        String accessToken = jwtService.generateAccessToken(member);
        String refreshToken = refreshTokenService.createRefreshToken(member, client);
        return LoginResponse.of(accessToken, refreshToken,
                jwtService.getAccessTokenTtlSeconds(), PrincipalDto.fromMember(member));
    }
}
