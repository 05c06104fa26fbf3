package dev.hrats;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.hrats.cli.ApplicantFormatter;
import dev.hrats.cli.ConsoleOutput;
import dev.hrats.config.HrAtsProperties;
import dev.hrats.entity.Applicant;
import dev.hrats.entity.EmailTemplate;
import dev.hrats.exception.HrAtsException;
import dev.hrats.exception.ValidationException;
import dev.hrats.model.ApplicantDraft;
import dev.hrats.model.ApplicantFilter;
import dev.hrats.model.ApplicantStatus;
import dev.hrats.model.ComposedEmail;
import dev.hrats.model.ImportResult;
import dev.hrats.model.TrackerSettings;
import dev.hrats.service.ApplicantImportService;
import dev.hrats.service.ApplicantService;
import dev.hrats.service.DashboardService;
import dev.hrats.service.EmailComposerService;
import dev.hrats.service.EmailTemplateService;
import dev.hrats.service.MailClientLauncher;
import dev.hrats.service.OfferLetterService;
import dev.hrats.service.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Parses the command line and runs one command against the record store.
 * Separated from the main Application class for testability.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommandRunner {

  public static final int EXIT_OK = 0;
  public static final int EXIT_ERROR = 1;
  public static final int EXIT_USAGE = 2;

  static final String USAGE = """
      Usage: hr-ats <command> [arguments]

        add --name=NAME [--email=] [--phone=] [--job=] [--applied=YYYY-MM-DD] [--source=] [--notes=]
        import FILE.csv
        list [--status=Label[,Label]] [--job=TEXT] [--from=YYYY-MM-DD] [--to=YYYY-MM-DD] [--json]
        show ID
        status ID STATUS
        interview ID YYYY-MM-DD
        delete ID --yes
        dashboard
        email ID TEMPLATE_NAME
        offer ID [--out=DIR]
        templates list
        templates add --name=NAME [--subject=] [--body=]
        templates update NAME [--name=NEW_NAME] [--subject=] [--body=]
        templates delete NAME --yes
        settings show
        settings default-status STATUS

      Statuses: %s
      """;

  private final ApplicantService applicantService;
  private final ApplicantImportService importService;
  private final EmailTemplateService templateService;
  private final EmailComposerService emailComposer;
  private final MailClientLauncher mailClientLauncher;
  private final OfferLetterService offerLetterService;
  private final DashboardService dashboardService;
  private final SettingsService settingsService;
  private final HrAtsProperties properties;
  private final ConsoleOutput console;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Run a single command.
   *
   * @return process exit code
   */
  public int execute(String... args) {
    ApplicationArguments arguments = new DefaultApplicationArguments(args);
    List<String> positional = arguments.getNonOptionArgs();
    if (positional.isEmpty()) {
      printUsage();
      return EXIT_USAGE;
    }

    String command = positional.get(0);
    log.debug("Running command '{}' with {}", command, Arrays.toString(args));
    try {
      switch (command) {
        case "add" -> add(arguments);
        case "import" -> importCsv(arguments);
        case "list" -> list(arguments);
        case "show" -> show(arguments);
        case "status" -> updateStatus(arguments);
        case "interview" -> scheduleInterview(arguments);
        case "delete" -> delete(arguments);
        case "dashboard" -> dashboard();
        case "email" -> email(arguments);
        case "offer" -> offer(arguments);
        case "templates" -> templates(arguments);
        case "settings" -> settings(arguments);
        case "help" -> printUsage();
        default -> throw new UsageException("Unknown command '" + command + "'");
      }
      return EXIT_OK;
    } catch (UsageException e) {
      console.error("%s", e.getMessage());
      printUsage();
      return EXIT_USAGE;
    } catch (HrAtsException e) {
      log.error("Command '{}' failed: {}", command, e.getMessage());
      console.error("Error: %s", e.getMessage());
      return EXIT_ERROR;
    }
  }

  // Applicants

  private void add(ApplicationArguments args) {
    ApplicantDraft draft = ApplicantDraft.builder()
        .name(option(args, "name"))
        .email(option(args, "email"))
        .phone(option(args, "phone"))
        .job(option(args, "job"))
        .notes(option(args, "notes"))
        .source(option(args, "source"))
        .appliedDate(dateOption(args, "applied"))
        .build();
    Applicant applicant = applicantService.create(draft, settingsService.current());
    console.line("Added applicant #%d %s (%s)", applicant.getId(), applicant.getName(),
        applicant.getStatus().getLabel());
  }

  private void importCsv(ApplicationArguments args) {
    Path file = Path.of(positional(args, 1, "FILE"));
    ImportResult result = importService.importCsv(file, settingsService.current());
    console.line("Imported %d new applicants.", result.createdCount());
    if (result.rejectedCount() > 0) {
      console.line("Skipped %d malformed rows:", result.rejectedCount());
      result.errors().forEach(error -> console.line("  %s", error));
    }
  }

  private void list(ApplicationArguments args) {
    ApplicantFilter filter = ApplicantFilter.all()
        .withStatuses(statusesOption(args, "status"))
        .withJob(option(args, "job"))
        .appliedBetween(dateOption(args, "from"), dateOption(args, "to"));
    List<Applicant> applicants = applicantService.list(filter).toList();

    if (args.containsOption("json")) {
      console.line(toJson(applicants));
      return;
    }
    console.line(ApplicantFormatter.header());
    applicants.forEach(a -> console.line(ApplicantFormatter.row(a)));
    console.line("%d applicant(s)", applicants.size());
  }

  private void show(ApplicationArguments args) {
    Long id = idArgument(args, 1);
    Applicant applicant = applicantService.get(id);
    ApplicantFormatter.details(applicant, applicantService.history(id)).forEach(console::line);
  }

  private void updateStatus(ApplicationArguments args) {
    Long id = idArgument(args, 1);
    ApplicantStatus status = ApplicantStatus.fromLabel(positional(args, 2, "STATUS"));
    Applicant applicant = applicantService.updateStatus(id, status);
    console.line("Applicant #%d is now %s", applicant.getId(), applicant.getStatus().getLabel());
  }

  private void scheduleInterview(ApplicationArguments args) {
    Long id = idArgument(args, 1);
    LocalDate date = parseDate(positional(args, 2, "DATE"), "interview date");
    Applicant applicant = applicantService.scheduleInterview(id, date);
    console.line("Interview for #%d %s set to %s", applicant.getId(), applicant.getName(),
        applicant.getInterviewDate());
  }

  private void delete(ApplicationArguments args) {
    Long id = idArgument(args, 1);
    requireConfirmation(args, "applicant #" + id);
    applicantService.delete(id);
    console.line("Deleted applicant #%d", id);
  }

  private void dashboard() {
    ApplicantFormatter.dashboard(dashboardService.summary(LocalDate.now(clock))).forEach(console::line);
  }

  // Email and export

  private void email(ApplicationArguments args) {
    Long id = idArgument(args, 1);
    String templateName = remaining(args, 2, "TEMPLATE_NAME");
    ComposedEmail email = emailComposer.compose(id, templateName);

    if (properties.getEmail().isOpenClient() && mailClientLauncher.open(email.mailto())) {
      console.line("Opened mail client for %s", email.recipient());
      return;
    }
    console.line("To: %s", email.recipient());
    console.line("Subject: %s", email.subject());
    console.line("");
    console.line(email.body());
    console.line("");
    console.line(email.mailto().toString());
  }

  private void offer(ApplicationArguments args) {
    Long id = idArgument(args, 1);
    String out = option(args, "out");
    Path dir = Path.of(out != null ? out : properties.getExportDir());
    Path pdf = offerLetterService.generate(id, dir);
    console.line("Saved as: %s", pdf);
  }

  // Templates

  private void templates(ApplicationArguments args) {
    String action = positional(args, 1, "list|add|update|delete");
    switch (action) {
      case "list" -> templateService.list().forEach(t -> console.line(ApplicantFormatter.template(t)));
      case "add" -> {
        EmailTemplate created = templateService.create(
            option(args, "name"),
            optionOrDefault(args, "subject", "Subject line..."),
            optionOrDefault(args, "body", "Dear {name},\n\n..."));
        console.line("Created template '%s'", created.getName());
      }
      case "update" -> {
        EmailTemplate updated = templateService.update(
            remaining(args, 2, "NAME"), option(args, "name"), option(args, "subject"), option(args, "body"));
        console.line("Template '%s' saved.", updated.getName());
      }
      case "delete" -> {
        String name = remaining(args, 2, "NAME");
        requireConfirmation(args, "template '" + name + "'");
        templateService.delete(name);
        console.line("Deleted template '%s'", name);
      }
      default -> throw new UsageException("Unknown templates action '" + action + "'");
    }
  }

  // Settings

  private void settings(ApplicationArguments args) {
    String action = positional(args, 1, "show|default-status");
    switch (action) {
      case "show" -> {
        TrackerSettings current = settingsService.current();
        console.line("Default applied status: %s", current.defaultStatus().getLabel());
      }
      case "default-status" -> {
        ApplicantStatus status = ApplicantStatus.fromLabel(positional(args, 2, "STATUS"));
        settingsService.updateDefaultStatus(status);
        console.line("General settings saved. Default status: %s", status.getLabel());
      }
      default -> throw new UsageException("Unknown settings action '" + action + "'");
    }
  }

  // Argument helpers

  private void printUsage() {
    console.line(String.format(USAGE, ApplicantStatus.labels()));
  }

  private static String option(ApplicationArguments args, String name) {
    List<String> values = args.getOptionValues(name);
    if (values == null || values.isEmpty()) {
      return null;
    }
    return values.get(0);
  }

  private static String optionOrDefault(ApplicationArguments args, String name, String fallback) {
    String value = option(args, name);
    return value != null ? value : fallback;
  }

  private static LocalDate dateOption(ApplicationArguments args, String name) {
    String value = option(args, name);
    return value == null || value.isBlank() ? null : parseDate(value, name);
  }

  private static Set<ApplicantStatus> statusesOption(ApplicationArguments args, String name) {
    String value = option(args, name);
    if (value == null || value.isBlank()) {
      return null;
    }
    return Arrays.stream(value.split(","))
        .map(ApplicantStatus::fromLabel)
        .collect(Collectors.toCollection(() -> EnumSet.noneOf(ApplicantStatus.class)));
  }

  private static String positional(ApplicationArguments args, int index, String label) {
    List<String> values = args.getNonOptionArgs();
    if (values.size() <= index) {
      throw new UsageException("Missing argument " + label);
    }
    return values.get(index);
  }

  /**
   * Joins everything from {@code index} on, so unquoted multi-word names still work.
   */
  private static String remaining(ApplicationArguments args, int index, String label) {
    List<String> values = args.getNonOptionArgs();
    if (values.size() <= index) {
      throw new UsageException("Missing argument " + label);
    }
    return String.join(" ", values.subList(index, values.size()));
  }

  private static Long idArgument(ApplicationArguments args, int index) {
    String value = positional(args, index, "ID");
    try {
      return Long.valueOf(value);
    } catch (NumberFormatException e) {
      throw new UsageException("Applicant id must be a number, got '" + value + "'");
    }
  }

  private static LocalDate parseDate(String value, String field) {
    try {
      return LocalDate.parse(value.trim());
    } catch (DateTimeParseException e) {
      throw new ValidationException("Invalid " + field + " '" + value + "' (expected YYYY-MM-DD)");
    }
  }

  private static void requireConfirmation(ApplicationArguments args, String what) {
    if (!args.containsOption("yes")) {
      throw new UsageException("Refusing to delete " + what + " without --yes");
    }
  }

  private String toJson(List<Applicant> applicants) {
    try {
      return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(applicants);
    } catch (JsonProcessingException e) {
      throw new HrAtsException("Could not serialize applicants: " + e.getOriginalMessage(), e);
    }
  }

  static class UsageException extends RuntimeException {
    UsageException(String message) {
      super(message);
    }
  }
}
