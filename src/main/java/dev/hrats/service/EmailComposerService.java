package dev.hrats.service;

import dev.hrats.entity.Applicant;
import dev.hrats.entity.EmailTemplate;
import dev.hrats.exception.ValidationException;
import dev.hrats.metrics.TrackerMetrics;
import dev.hrats.model.ComposedEmail;
import dev.hrats.model.RenderedEmail;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * Builds mailto links from a template and an applicant.
 * Delivery is left to the user's mail client.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailComposerService {

    private final ApplicantService applicantService;
    private final EmailTemplateService templateService;
    private final TemplateRenderer renderer;
    private final TrackerMetrics metrics;

    /**
     * Compose an email for an applicant from a named template.
     *
     * @throws ValidationException if the applicant has no email address
     */
    public ComposedEmail compose(Long applicantId, String templateName) {
        Applicant applicant = applicantService.get(applicantId);
        String recipient = applicant.getEmail() != null ? applicant.getEmail().trim() : "";
        if (recipient.isEmpty()) {
            throw new ValidationException("Applicant " + applicantId + " has no email address");
        }

        EmailTemplate template = templateService.get(templateName);
        RenderedEmail rendered = renderer.render(template, applicant);
        URI mailto = mailto(recipient, rendered);
        metrics.recordEmailComposed();

        log.info("Composed '{}' email for applicant {}", template.getName(), applicantId);
        return new ComposedEmail(recipient, rendered.subject(), rendered.body(), mailto);
    }

    /**
     * mailto:recipient?subject=...&amp;body=... with RFC 3986 percent-encoding.
     */
    public URI mailto(String recipient, RenderedEmail email) {
        String link = "mailto:" + recipient
                + "?subject=" + UriUtils.encode(email.subject(), StandardCharsets.UTF_8)
                + "&body=" + UriUtils.encode(email.body(), StandardCharsets.UTF_8);
        try {
            return URI.create(link);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid email address '" + recipient + "'");
        }
    }
}
