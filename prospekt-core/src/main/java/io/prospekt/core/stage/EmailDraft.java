package io.prospekt.core.stage;

import java.util.Objects;

/// Outreach email generated for one contact.
///
/// @param recipient contact name, not null
/// @param title contact job title, not null
/// @param emailAddress destination address, never null
/// @param subject subject line, not null
/// @param body email body without subject or signature, not null
/// @param priorityScore the contact's priority score
public record EmailDraft(
        String recipient,
        String title,
        String emailAddress,
        String subject,
        String body,
        int priorityScore) {

    public EmailDraft {
        Objects.requireNonNull(recipient, "recipient must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(subject, "subject must not be null");
        Objects.requireNonNull(body, "body must not be null");
        emailAddress = emailAddress != null ? emailAddress : "";
    }
}
