package io.github.hatchcrm.aiemployees.tools;

/**
 * Outbound email and SMS supplied by the host CRM. Consent and quiet-hour rules are enforced
 * by the implementation, which throws when a message may not be sent.
 */
public interface MessagingGateway {

    /** @return the provider message id */
    String sendEmail(EmailMessage message);

    /** @return the provider message id */
    String sendSms(SmsMessage message);
}
