package com.jay.carbonscore.runner;

import com.jay.carbonscore.engine.CarbonFootprintService;
import com.jay.carbonscore.layer1_data.QuestionnaireParser;
import com.jay.carbonscore.layer1_data.QuestionnaireValidator;
import com.jay.carbonscore.layer5_report.CarbonReportGenerator;
import com.jay.carbonscore.model.CarbonFootprintResult;
import com.jay.carbonscore.model.CompanyData;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line entry point: {@code --questionnaire=<path>} reads a questionnaire JSON file,
 * validates it, runs the calculation and logs the text report.
 * Without the option the application starts and exits without calculating.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuestionnaireRunner implements ApplicationRunner {

    static final String OPTION = "questionnaire";

    private final QuestionnaireParser parser;
    private final QuestionnaireValidator validator;
    private final CarbonFootprintService footprintService;
    private final CarbonReportGenerator reportGenerator;

    @Override
    public void run(ApplicationArguments args) {
        List<String> paths = args.getOptionValues(OPTION);
        if (paths == null || paths.isEmpty()) {
            log.debug("No --{} option — nothing to calculate", OPTION);
            return;
        }
        for (String path : paths) {
            process(Path.of(path));
        }
    }

    /** Returns the result, or null when validation rejected the questionnaire. */
    CarbonFootprintResult process(Path file) {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read questionnaire " + file, e);
        }

        CompanyData data = parser.parse(json);
        QuestionnaireValidator.ValidationReport report = validator.validate(data);
        report.warnings().forEach(w -> log.warn("Questionnaire {}: {}", file.getFileName(), w));
        report.suggestions().forEach(s -> log.info("Questionnaire {}: {}", file.getFileName(), s));
        if (!report.valid()) {
            log.error("Questionnaire {} rejected: {}", file, String.join("; ", report.errors()));
            return null;
        }

        CarbonFootprintResult result = footprintService.calculate(data);
        log.info("\n{}", reportGenerator.generate(result));
        return result;
    }
}
