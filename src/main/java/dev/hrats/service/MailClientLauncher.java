package dev.hrats.service;

import java.net.URI;

/**
 * Hands a mailto link to the user's mail client.
 */
public interface MailClientLauncher {

    /**
     * Open the mail client with a prefilled message.
     *
     * @param mailto The mailto URI
     * @return true if the client was launched
     */
    boolean open(URI mailto);
}
