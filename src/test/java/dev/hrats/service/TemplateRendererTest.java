package dev.hrats.service;

import dev.hrats.entity.Applicant;
import dev.hrats.entity.EmailTemplate;
import dev.hrats.model.RenderedEmail;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    @DisplayName("Should replace name and job tokens")
    void shouldReplaceTokens() {
        assertThat(renderer.substitute("Hello {name}, re: {job}", "Ada", "Engineer"))
                .isEqualTo("Hello Ada, re: Engineer");
    }

    @Test
    @DisplayName("Should replace every occurrence")
    void shouldReplaceEveryOccurrence() {
        assertThat(renderer.substitute("{name} {name} {job}{job}", "Ada", "QA"))
                .isEqualTo("Ada Ada QAQA");
    }

    @Test
    @DisplayName("Missing fields render as empty text")
    void missingFieldsRenderEmpty() {
        String result = renderer.substitute("Dear {name}, the {job} role", null, null);

        assertThat(result).isEqualTo("Dear , the  role");
        assertThat(result).doesNotContain("{name}", "{job}");
    }

    @Test
    @DisplayName("Should leave unknown placeholders alone")
    void shouldLeaveUnknownPlaceholders() {
        assertThat(renderer.substitute("Hi {name}, see {company}", "Ada", "Engineer"))
                .isEqualTo("Hi Ada, see {company}");
    }

    @Test
    @DisplayName("Should render subject and body from an applicant")
    void shouldRenderTemplate() {
        EmailTemplate template = EmailTemplate.builder()
                .name("Offer Sent")
                .subject("Job Offer – {job}")
                .body("Dear {name},\n\nWelcome aboard.")
                .build();
        Applicant applicant = Applicant.builder().name("Grace").job("Admiral").build();

        RenderedEmail rendered = renderer.render(template, applicant);

        assertThat(rendered.subject()).isEqualTo("Job Offer – Admiral");
        assertThat(rendered.body()).isEqualTo("Dear Grace,\n\nWelcome aboard.");
    }

    @Test
    @DisplayName("Null template text renders as empty")
    void nullTextRendersEmpty() {
        assertThat(renderer.substitute(null, "Ada", "Engineer")).isEmpty();
    }
}
