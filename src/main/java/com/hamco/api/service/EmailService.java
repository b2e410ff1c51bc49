package com.hamco.api.service;

public interface EmailService {

    void sendVerificationEmail(String to, String rawToken);

    void sendPasswordResetEmail(String to, String rawToken);
}
