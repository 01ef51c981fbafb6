package com.codewatch.dispatch.cli;

import com.codewatch.core.engine.ReviewService;
import com.codewatch.core.model.Plan;
import com.codewatch.core.model.ReviewInput;
import com.codewatch.core.model.ReviewReport;
import com.codewatch.core.model.ReviewStatus;
import com.codewatch.core.plan.PlanCodec;
import com.codewatch.core.CodewatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;

/**
 * CLI command: codewatch review &lt;file&gt;
 * <p>
 * Reviews one source file, streaming agent activity as it happens, then prints the
 * report. Exit code 0 for a completed review, 1 for partial, 2 for failed.
 */
@Command(name = "review", mixinStandardHelpOptions = true, description = "Review a source file")
@Component
public class ReviewCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Source file to review")
    private Path file;

    @Option(names = {"--capabilities", "-c"}, split = ",",
            description = "Analysis capabilities to run (default: all)")
    private List<String> capabilities;

    @Option(names = "--plan", description = "JSON plan file to execute instead of the default plan")
    private Path planFile;

    @Option(names = "--json", description = "Print the final report as JSON")
    private boolean json;

    @Option(names = {"--quiet", "-q"}, description = "Do not stream events")
    private boolean quiet;

    private final ReviewService reviewService;
    private final ObjectMapper objectMapper;

    public ReviewCommand(ReviewService reviewService, ObjectMapper objectMapper) {
        this.reviewService = reviewService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        String code;
        Plan plan = null;
        try {
            code = Files.readString(file);
            if (planFile != null) {
                plan = PlanCodec.fromJson(Files.readString(planFile));
            }
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + e.getMessage());
            return 2;
        } catch (CodewatchException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Reviewing " + file);
        }

        var input = new ReviewInput(code, file.getFileName().toString(), capabilities);
        ReviewReport report;
        try {
            report = reviewService.run(input, plan, event -> {
                if (!quiet && !json) {
                    ConsoleOutput.event(event);
                }
            });
        } catch (IllegalArgumentException | CodewatchException e) {
            ConsoleOutput.error("Review failed: " + e.getMessage());
            return 2;
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ConsoleOutput.error("Review failed: " + cause.getMessage());
            return 2;
        }

        if (json) {
            try {
                System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Cannot serialize report: " + e.getMessage());
                return 2;
            }
        } else {
            ConsoleOutput.report(report);
        }
        return exitCode(report.status());
    }

    static int exitCode(ReviewStatus status) {
        return switch (status) {
            case COMPLETED -> 0;
            case PARTIAL -> 1;
            default -> 2;
        };
    }
}
