package dev.hrats.model;

import java.net.URI;

/**
 * An email ready to hand to the desktop mail client.
 */
public record ComposedEmail(String recipient, String subject, String body, URI mailto) {
}
