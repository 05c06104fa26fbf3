package dev.hrats.service;

import dev.hrats.entity.Applicant;
import dev.hrats.entity.EmailTemplate;
import dev.hrats.model.RenderedEmail;
import org.springframework.stereotype.Component;

/**
 * Substitutes {name} and {job} in a template's subject and body.
 * A missing applicant field is rendered as an empty string.
 */
@Component
public class TemplateRenderer {

    public static final String NAME_TOKEN = "{name}";
    public static final String JOB_TOKEN = "{job}";

    public RenderedEmail render(EmailTemplate template, Applicant applicant) {
        return new RenderedEmail(
                substitute(template.getSubject(), applicant.getName(), applicant.getJob()),
                substitute(template.getBody(), applicant.getName(), applicant.getJob()));
    }

    public String substitute(String text, String name, String job) {
        if (text == null) {
            return "";
        }
        return text
                .replace(NAME_TOKEN, name != null ? name : "")
                .replace(JOB_TOKEN, job != null ? job : "");
    }
}
