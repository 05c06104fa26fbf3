package dev.hrats.service;

import dev.hrats.entity.Applicant;
import dev.hrats.exception.HrAtsException;
import dev.hrats.exception.ValidationException;
import dev.hrats.metrics.TrackerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Writes offer letters as single-page PDFs.
 * The letter text comes from the Thymeleaf text template offer/offer-letter.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfferLetterService {

    static final String TEMPLATE = "offer/offer-letter";

    private static final float MARGIN_LEFT = 80f;
    private static final float FIRST_LINE_Y = 750f;
    private static final float LEADING = 20f;
    private static final float TITLE_SIZE = 16f;
    private static final float BODY_SIZE = 12f;

    private final ApplicantService applicantService;
    private final TemplateEngine templateEngine;
    private final TrackerMetrics metrics;
    private final Clock clock;

    /**
     * Generate the offer letter for an applicant.
     *
     * @param applicantId Applicant to write the letter for; needs a name and a job
     * @param outputDir   Directory for the PDF, created if missing
     * @return Path of the written PDF
     */
    public Path generate(Long applicantId, Path outputDir) {
        Applicant applicant = applicantService.get(applicantId);
        if (isBlank(applicant.getName()) || isBlank(applicant.getJob())) {
            throw new ValidationException("Name and job title are required for an offer letter");
        }

        LocalDate today = LocalDate.now(clock);
        List<String> lines = renderLetter(applicant, today).lines().toList();
        Path target = outputDir.resolve(fileName(applicant.getName(), today));

        try {
            Files.createDirectories(outputDir);
            writePdf(lines, target, applicant.getName());
        } catch (IOException e) {
            throw new HrAtsException("Could not write offer letter to " + target + ": " + e.getMessage(), e);
        }

        metrics.recordOfferLetter();
        log.info("Offer letter for applicant {} saved as {}", applicantId, target);
        return target;
    }

    static String fileName(String name, LocalDate date) {
        String safeName = name.trim()
                .replaceAll("[\\\\/:*?\"<>|]", "")
                .replaceAll("\\s+", "_");
        return "Offer_" + safeName + "_" + date + ".pdf";
    }

    private String renderLetter(Applicant applicant, LocalDate date) {
        Context context = new Context(Locale.getDefault());
        context.setVariable("name", applicant.getName());
        context.setVariable("job", applicant.getJob());
        context.setVariable("date", date.toString());
        return templateEngine.process(TEMPLATE, context);
    }

    private void writePdf(List<String> lines, Path target, String applicantName) throws IOException {
        PDType1Font titleFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        PDType1Font bodyFont = new PDType1Font(Standard14Fonts.FontName.HELVETICA);

        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(PDRectangle.LETTER);
            document.addPage(page);

            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                float y = FIRST_LINE_Y;
                boolean titleWritten = false;
                for (String line : lines) {
                    if (!line.isBlank()) {
                        PDType1Font font = titleWritten ? bodyFont : titleFont;
                        content.beginText();
                        content.setFont(font, titleWritten ? BODY_SIZE : TITLE_SIZE);
                        content.newLineAtOffset(MARGIN_LEFT, y);
                        content.showText(encodable(font, line.strip()));
                        content.endText();
                        titleWritten = true;
                    }
                    y -= LEADING;
                }
            }

            document.getDocumentInformation().setTitle("Offer of Employment - " + applicantName);
            document.save(target.toFile());
        }
    }

    /**
     * Replace characters the standard 14 fonts cannot encode with '?'.
     */
    private static String encodable(PDType1Font font, String text) {
        StringBuilder out = new StringBuilder(text.length());
        text.codePoints().forEach(cp -> {
            String ch = new String(Character.toChars(cp));
            try {
                font.encode(ch);
                out.append(ch);
            } catch (IllegalArgumentException | IOException e) {
                out.append('?');
            }
        });
        return out.toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
