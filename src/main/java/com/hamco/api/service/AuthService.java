package com.hamco.api.service;

import com.hamco.api.dto.ForgotPasswordRequest;
import com.hamco.api.dto.LoginRequest;
import com.hamco.api.dto.LoginResponse;
import com.hamco.api.dto.MessageResponse;
import com.hamco.api.dto.ProfileResponse;
import com.hamco.api.dto.RegistrationRequest;
import com.hamco.api.dto.RegistrationResponse;
import com.hamco.api.dto.ResetPasswordRequest;
import com.hamco.api.model.AuthPrincipal;

public interface AuthService {

    RegistrationResponse register(RegistrationRequest request);

    MessageResponse verifyEmail(String token);

    LoginResponse login(LoginRequest request);

    /** Same answer whether or not the address is registered. */
    MessageResponse forgotPassword(ForgotPasswordRequest request);

    MessageResponse resetPassword(ResetPasswordRequest request);

    ProfileResponse profile(AuthPrincipal principal);
}
