package com.hamco.api.serviceImpl;

import com.hamco.api.SecurityConfig.JwtTokenProviderConfig;
import com.hamco.api.config.AppProperties;
import com.hamco.api.dto.ForgotPasswordRequest;
import com.hamco.api.dto.LoginRequest;
import com.hamco.api.dto.LoginResponse;
import com.hamco.api.dto.MessageResponse;
import com.hamco.api.dto.ProfileResponse;
import com.hamco.api.dto.RegistrationRequest;
import com.hamco.api.dto.RegistrationResponse;
import com.hamco.api.dto.ResetPasswordRequest;
import com.hamco.api.dto.UserSummary;
import com.hamco.api.entity.User;
import com.hamco.api.entity.UserRole;
import com.hamco.api.exception.AuthExceptions;
import com.hamco.api.exception.ResourceExceptions;
import com.hamco.api.model.AuthMethod;
import com.hamco.api.model.AuthPrincipal;
import com.hamco.api.model.IssuedToken;
import com.hamco.api.repository.UserRepository;
import com.hamco.api.service.AuthService;
import com.hamco.api.service.EmailService;
import com.hamco.api.service.PasswordHasher;
import com.hamco.api.utils.SecretTokens;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuthServiceImpl implements AuthService {

    static final String FORGOT_PASSWORD_MESSAGE =
            "If your email is registered, you will receive a password reset link shortly.";

    /** Valid BCrypt string compared against when the e-mail is unknown, so both paths cost a hash check. */
    private static final String DUMMY_HASH = "$2a$12$C6UzMDM.H6dfI/f/IKxGhuXsnwO0x6lS9yJx1Nt9Dzp4ZJ3Gx1gKe";

    private final UserRepository userRepository;
    private final PasswordHasher passwordHasher;
    private final JwtTokenProviderConfig tokenProvider;
    private final EmailService emailService;
    private final AppProperties appProperties;
    private final Clock clock;

    @Override
    @Transactional
    public RegistrationResponse register(RegistrationRequest request) {
        if (!appProperties.registration().allowed()) {
            throw new AuthExceptions.RegistrationDisabled();
        }

        final String email = normalizeEmail(request.getEmail());
        Optional<User> existing = userRepository.findByEmail(email);
        if (existing.isPresent()) {
            User user = existing.get();
            if (user.isEmailVerified()) {
                throw new ResourceExceptions.Conflict("Email already exists");
            }
            // Unverified account: fresh link, no duplicate row
            String rawToken = assignVerificationToken(user);
            userRepository.save(user);
            emailService.sendVerificationEmail(email, rawToken);
            log.info("Re-sent verification link to unverified account email={}", email);
            return RegistrationResponse.builder()
                    .message("Account already exists but is not verified. We sent a new verification email.")
                    .email(email)
                    .requiresEmailVerification(true)
                    .resent(true)
                    .build();
        }

        boolean firstUser = userRepository.count() == 0;
        User user = User.builder()
                .email(email)
                .username(request.getUsername().trim())
                .passwordHash(passwordHasher.hash(request.getPassword()))
                .role(firstUser ? UserRole.ADMIN : UserRole.USER)
                .emailVerified(false)
                .build();
        String rawToken = assignVerificationToken(user);
        userRepository.save(user);
        emailService.sendVerificationEmail(email, rawToken);

        log.info("Registered email={} role={}", email, user.getRole());
        return RegistrationResponse.builder()
                .message("Registration successful. Please verify your email.")
                .email(email)
                .requiresEmailVerification(true)
                .resent(false)
                .build();
    }

    @Override
    @Transactional
    public MessageResponse verifyEmail(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthExceptions.InvalidOneTimeToken("Invalid verification token");
        }
        User user = userRepository
                .findByEmailVerificationTokenHashAndEmailVerificationTokenExpiresAtAfter(
                        SecretTokens.sha256Hex(token.trim()), clock.instant())
                .orElseThrow(() -> new AuthExceptions.InvalidOneTimeToken("Invalid or expired verification token"));

        user.setEmailVerified(true);
        user.setEmailVerificationTokenHash(null);
        user.setEmailVerificationTokenExpiresAt(null);
        userRepository.save(user);

        log.info("Email verified for email={}", user.getEmail());
        return new MessageResponse("Email verified. You can now log in.");
    }

    @Override
    @Transactional(readOnly = true)
    public LoginResponse login(LoginRequest request) {
        final String email = normalizeEmail(request.getEmail());
        final String password = request.getPassword();

        Optional<User> found = userRepository.findByEmail(email);
        if (found.isEmpty()) {
            passwordHasher.verify(password, DUMMY_HASH);
            log.warn("Login failed for unknown email={}", email);
            throw new AuthExceptions.InvalidCredentials();
        }
        User user = found.get();
        if (!passwordHasher.verify(password, user.getPasswordHash())) {
            log.warn("Login failed for email={}: bad password", email);
            throw new AuthExceptions.InvalidCredentials();
        }
        if (!user.isEmailVerified()) {
            throw new AuthExceptions.EmailNotVerified();
        }

        IssuedToken issued = tokenProvider.issue(user);
        log.info("Login success for email={}", email);
        return LoginResponse.builder()
                .token(issued.token())
                .expiresIn(tokenProvider.getLifetime().toSeconds())
                .expiresAt(issued.expiresAt())
                .userId(user.getId().toString())
                .email(user.getEmail())
                .roles(user.roleNames())
                .build();
    }

    @Override
    @Transactional
    public MessageResponse forgotPassword(ForgotPasswordRequest request) {
        final String email = normalizeEmail(request.email());
        userRepository.findByEmail(email).ifPresentOrElse(user -> {
            String rawToken = SecretTokens.generateRawToken();
            user.setPasswordResetTokenHash(SecretTokens.sha256Hex(rawToken));
            user.setPasswordResetTokenExpiresAt(tokenExpiry());
            userRepository.save(user);
            emailService.sendPasswordResetEmail(email, rawToken);
            log.info("Password reset link issued for email={}", email);
        }, () -> log.debug("Password reset requested for unknown email={}", email));
        return new MessageResponse(FORGOT_PASSWORD_MESSAGE);
    }

    @Override
    @Transactional
    public MessageResponse resetPassword(ResetPasswordRequest request) {
        User user = userRepository
                .findByPasswordResetTokenHashAndPasswordResetTokenExpiresAtAfter(
                        SecretTokens.sha256Hex(request.getToken().trim()), clock.instant())
                .orElseThrow(() -> new AuthExceptions.InvalidOneTimeToken("Invalid or expired reset token"));

        user.setPasswordHash(passwordHasher.hash(request.getNewPassword()));
        user.setPasswordResetTokenHash(null);
        user.setPasswordResetTokenExpiresAt(null);
        userRepository.save(user);

        log.info("Password reset completed for email={}", user.getEmail());
        return new MessageResponse("Password reset successful. You can now log in.");
    }

    @Override
    @Transactional(readOnly = true)
    public ProfileResponse profile(AuthPrincipal principal) {
        if (principal == null) {
            throw new AuthExceptions.NotAuthenticated();
        }
        ProfileResponse.ProfileResponseBuilder builder = ProfileResponse.builder()
                .subjectId(principal.subjectId())
                .label(principal.label())
                .roles(principal.roles())
                .method(principal.method().tag())
                .apiKeyId(principal.apiKeyId());

        if (principal.method() == AuthMethod.TOKEN) {
            // A token can outlive its account
            User user = parseUuid(principal.subjectId())
                    .flatMap(userRepository::findById)
                    .orElseThrow(AuthExceptions.NotAuthenticated::new);
            builder.user(UserSummary.from(user));
        }
        return builder.build();
    }

    // -------------------- helpers --------------------

    private String assignVerificationToken(User user) {
        String rawToken = SecretTokens.generateRawToken();
        user.setEmailVerificationTokenHash(SecretTokens.sha256Hex(rawToken));
        user.setEmailVerificationTokenExpiresAt(tokenExpiry());
        return rawToken;
    }

    private Instant tokenExpiry() {
        return clock.instant().plus(appProperties.tokens().ttl());
    }

    private String normalizeEmail(String email) {
        if (email == null) throw new AuthExceptions.InvalidCredentials();
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static Optional<UUID> parseUuid(String value) {
        try {
            return Optional.of(UUID.fromString(value));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
