package dev.hrats.service;

import dev.hrats.entity.EmailTemplate;
import dev.hrats.exception.NotFoundException;
import dev.hrats.exception.ValidationException;
import dev.hrats.repository.EmailTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * CRUD for email templates. Names are unique and never blank.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailTemplateService {

    static final List<EmailTemplate> DEFAULT_TEMPLATES = List.of(
            EmailTemplate.builder()
                    .name("Interview Invite")
                    .subject("Interview Invitation – {job}")
                    .body("Hi {name},\n\nWe would like to invite you to interview for the {job} position.\n\n"
                            + "Best regards,\nHR Team")
                    .build(),
            EmailTemplate.builder()
                    .name("Offer Sent")
                    .subject("Job Offer – {job}")
                    .body("Dear {name},\n\nCongratulations! We are pleased to offer you the {job} position.\n\n"
                            + "HR Team")
                    .build(),
            EmailTemplate.builder()
                    .name("Rejection")
                    .subject("Application Update")
                    .body("Dear {name},\n\nThank you for your interest in the {job} position.\n\n"
                            + "We have decided to move forward with other candidates.\n\nBest wishes,\nHR Team")
                    .build());

    private final EmailTemplateRepository templateRepository;

    public List<EmailTemplate> list() {
        return templateRepository.findAllByOrderByNameAsc();
    }

    public EmailTemplate get(String name) {
        String key = trimToNull(name);
        if (key == null) {
            throw new ValidationException("Template name is required");
        }
        return templateRepository.findByName(key)
                .orElseThrow(() -> NotFoundException.template(key));
    }

    @Transactional
    public EmailTemplate create(String name, String subject, String body) {
        String key = requireName(name);
        if (templateRepository.existsByName(key)) {
            throw new ValidationException("Template name '" + key + "' already exists");
        }
        EmailTemplate saved = templateRepository.save(EmailTemplate.builder()
                .name(key)
                .subject(subject != null ? subject : "")
                .body(body != null ? body.stripTrailing() : "")
                .build());
        log.info("Created email template '{}'", key);
        return saved;
    }

    /**
     * Update a template, optionally renaming it. Null arguments keep the current value.
     */
    @Transactional
    public EmailTemplate update(String currentName, String newName, String subject, String body) {
        EmailTemplate template = get(currentName);

        if (newName != null) {
            String key = requireName(newName);
            if (!key.equals(template.getName()) && templateRepository.existsByName(key)) {
                throw new ValidationException("Template name '" + key + "' already in use");
            }
            template.setName(key);
        }
        if (subject != null) {
            template.setSubject(subject);
        }
        if (body != null) {
            template.setBody(body.stripTrailing());
        }

        EmailTemplate saved = templateRepository.save(template);
        log.info("Updated email template '{}'", saved.getName());
        return saved;
    }

    @Transactional
    public void delete(String name) {
        EmailTemplate template = get(name);
        templateRepository.delete(template);
        log.info("Deleted email template '{}'", template.getName());
    }

    /**
     * Insert the stock templates when the store has none.
     *
     * @return number of templates inserted
     */
    @Transactional
    public int seedDefaults() {
        if (templateRepository.count() > 0) {
            return 0;
        }
        List<EmailTemplate> seeded = DEFAULT_TEMPLATES.stream()
                .map(t -> EmailTemplate.builder()
                        .name(t.getName())
                        .subject(t.getSubject())
                        .body(t.getBody())
                        .build())
                .toList();
        templateRepository.saveAll(seeded);
        log.info("Seeded {} default email templates", seeded.size());
        return seeded.size();
    }

    private static String requireName(String name) {
        String key = trimToNull(name);
        if (key == null) {
            throw new ValidationException("Template name is required");
        }
        return key;
    }

    private static String trimToNull(String value) {
        return ApplicantService.trimToNull(value);
    }
}
