package com.hamco.api.serviceImpl;

import com.hamco.api.config.AppProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("MailEmailService Tests")
class MailEmailServiceTest {

    private static final AppProperties PROPS = new AppProperties(
            "https://hamco.dev",
            "no-reply@hamco.dev",
            new AppProperties.Registration(true),
            new AppProperties.Tokens(Duration.ofMinutes(20)),
            new AppProperties.Init(new AppProperties.Admin(null, null)));

    @SuppressWarnings("unchecked")
    private static ObjectProvider<JavaMailSender> providerOf(JavaMailSender sender) {
        ObjectProvider<JavaMailSender> provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(sender);
        return provider;
    }

    @Nested
    @DisplayName("Without a mail host")
    class NoHost {

        @Test
        @DisplayName("Default configuration creates no JavaMailSender")
        void defaultConfigHasNoSender() {
            new ApplicationContextRunner()
                    .withInitializer(new ConfigDataApplicationContextInitializer())
                    .withConfiguration(AutoConfigurations.of(MailSenderAutoConfiguration.class))
                    .run(context -> assertThat(context).doesNotHaveBean(JavaMailSender.class));
        }

        @Test
        @DisplayName("Setting spring.mail.host brings the sender back")
        void hostCreatesSender() {
            new ApplicationContextRunner()
                    .withInitializer(new ConfigDataApplicationContextInitializer())
                    .withConfiguration(AutoConfigurations.of(MailSenderAutoConfiguration.class))
                    .withPropertyValues("spring.mail.host=smtp.hamco.dev")
                    .run(context -> assertThat(context).hasSingleBean(JavaMailSender.class));
        }

        @Test
        @DisplayName("Links are logged instead of sent")
        void logsInstead() {
            MailEmailService service = new MailEmailService(providerOf(null), PROPS);

            assertThatCode(() -> service.sendVerificationEmail("ada@hamco.dev", "raw"))
                    .doesNotThrowAnyException();
            assertThatCode(() -> service.sendPasswordResetEmail("ada@hamco.dev", "raw"))
                    .doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("With a mail host")
    class WithHost {

        @Test
        @DisplayName("Verification mail carries the link built from the base URL")
        void sendsVerificationLink() {
            JavaMailSender sender = mock(JavaMailSender.class);
            new MailEmailService(providerOf(sender), PROPS).sendVerificationEmail("ada@hamco.dev", "abc123");

            ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
            verify(sender).send(sent.capture());
            assertThat(sent.getValue().getTo()).containsExactly("ada@hamco.dev");
            assertThat(sent.getValue().getFrom()).isEqualTo("no-reply@hamco.dev");
            assertThat(sent.getValue().getText())
                    .contains("https://hamco.dev/api/auth/verify-email?token=abc123")
                    .contains("20 minutes");
        }

        @Test
        @DisplayName("Transport failure is logged, not thrown")
        void failureSwallowed() {
            JavaMailSender sender = mock(JavaMailSender.class);
            doThrow(new MailSendException("smtp down")).when(sender).send(any(SimpleMailMessage.class));

            assertThatCode(() -> new MailEmailService(providerOf(sender), PROPS)
                    .sendPasswordResetEmail("ada@hamco.dev", "abc123"))
                    .doesNotThrowAnyException();
        }
    }
}
