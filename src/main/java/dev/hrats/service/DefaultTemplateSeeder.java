package dev.hrats.service;

import dev.hrats.config.HrAtsProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationStartedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Seeds the stock email templates once the context is up, before any command runs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultTemplateSeeder {

    private final EmailTemplateService templateService;
    private final HrAtsProperties properties;

    @EventListener(ApplicationStartedEvent.class)
    public void seed() {
        if (!properties.getTemplates().isSeedDefaults()) {
            log.debug("Default template seeding disabled");
            return;
        }
        templateService.seedDefaults();
    }
}
