package com.hamco.api.exception;

import org.springframework.http.HttpStatus;

/**
 * Account and credential failures raised by the auth endpoints.
 * Details are deliberately uniform so responses cannot be used to enumerate accounts.
 */
public final class AuthExceptions {

    private AuthExceptions() {}

    /** 401 – unknown e-mail or wrong password; both look the same. */
    public static final class InvalidCredentials extends ApiException {
        public InvalidCredentials() {
            super(HttpStatus.UNAUTHORIZED, "invalid-credentials", "Unauthorized", "Invalid email or password");
        }
    }

    /** 401 – endpoint needs an authenticated principal and none is attached. */
    public static final class NotAuthenticated extends ApiException {
        public NotAuthenticated() {
            super(HttpStatus.UNAUTHORIZED, "unauthorized", "Unauthorized",
                    "Authentication is required to access this resource.");
        }
    }

    /** 403 – password is right but the address was never confirmed. */
    public static final class EmailNotVerified extends ApiException {
        public EmailNotVerified() {
            super(HttpStatus.FORBIDDEN, "email-not-verified", "Email Not Verified",
                    "Please verify your email before logging in.");
        }
    }

    /** 403 – public sign-up is switched off. */
    public static final class RegistrationDisabled extends ApiException {
        public RegistrationDisabled() {
            super(HttpStatus.FORBIDDEN, "registration-disabled", "Registration Disabled",
                    "Registration is currently disabled");
        }
    }

    /** 400 – verification or reset token unknown, used or expired. */
    public static final class InvalidOneTimeToken extends ApiException {
        public InvalidOneTimeToken(String detail) {
            super(HttpStatus.BAD_REQUEST, "invalid-token", "Invalid Token", detail);
        }
    }
}
