package dev.hrats.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Application settings.
 * Loaded from application.yml under 'hrats' prefix.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "hrats")
public class HrAtsProperties {

    /**
     * Status given to new applicants until one is saved through the settings command.
     */
    private String defaultStatus = "Applied";

    /**
     * Directory offer letters are written to.
     */
    private String exportDir = ".";

    private Email email = new Email();
    private Templates templates = new Templates();
    private Dashboard dashboard = new Dashboard();
    private Csv csv = new Csv();

    @Data
    public static class Email {
        private boolean openClient = false;
    }

    @Data
    public static class Templates {
        private boolean seedDefaults = true;
    }

    @Data
    public static class Dashboard {
        private int upcomingDays = 7;
        private int recentDays = 7;
        private int recentLimit = 12;
    }

    @Data
    public static class Csv {
        private String sourceLabel = "CSV Import";
    }
}
