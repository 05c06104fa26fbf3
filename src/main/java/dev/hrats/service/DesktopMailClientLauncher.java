package dev.hrats.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/**
 * Launches the platform mail client through {@link Desktop}.
 * Returns false on headless machines so the caller can print the link instead.
 */
@Slf4j
@Service
public class DesktopMailClientLauncher implements MailClientLauncher {

    @Override
    public boolean open(URI mailto) {
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()
                || !Desktop.getDesktop().isSupported(Desktop.Action.MAIL)) {
            log.info("No desktop mail client available");
            return false;
        }
        try {
            Desktop.getDesktop().mail(mailto);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Failed to launch mail client: {}", e.getMessage());
            return false;
        }
    }
}
