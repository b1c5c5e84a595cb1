package com.canary.app;

import com.canary.core.config.IntelConfig;
import com.canary.core.error.IntelException;
import com.canary.core.model.Headline;
import com.canary.intel.CanaryIntelligence;
import com.canary.intel.MaintenanceResult;
import com.canary.intel.lock.JobLock;
import com.canary.intel.lock.JobType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Optional;

/**
 * Command line access to the intelligence engine. Results are printed as JSON.
 *
 * <pre>
 * canary report                      learned-state summary
 * canary accuracy [days]             prediction accuracy, all time or the last N days
 * canary feedback-summary            feedback counts and learning status
 * canary maintain                    decay and corrupt-record sweep (one run at a time)
 * canary predict "headline" source   score a headline
 * </pre>
 */
public class IntelApp {
    private static final Logger LOG = LoggerFactory.getLogger(IntelApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_BUSY = 3;

    private final IntelConfig config;
    private final PrintStream out;
    private final PrintStream err;
    private final ObjectMapper mapper;

    public IntelApp(IntelConfig config, PrintStream out, PrintStream err) {
        this.config = config;
        this.out = out;
        this.err = err;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static void main(String[] args) {
        int code;
        try {
            code = new IntelApp(IntelConfig.load(), System.out, System.err).run(args);
        } catch (IntelException e) {
            LOG.error("Canary failed", e);
            System.err.println("Error: " + e.getMessage());
            code = EXIT_ERROR;
        }
        System.exit(code);
    }

    public int run(String[] args) {
        if (args.length == 0) {
            usage();
            return EXIT_USAGE;
        }
        String command = args[0];
        switch (command) {
            case "report":
                return withEngine(intel -> print(intel.intelligenceReport()));
            case "feedback-summary":
                return withEngine(intel -> print(intel.feedbackSummary()));
            case "accuracy":
                return accuracy(args);
            case "maintain":
                return withEngine(this::maintain);
            case "predict":
                return predict(args);
            case "help":
            case "--help":
                usage();
                return EXIT_OK;
            default:
                err.println("Unknown command: " + command);
                usage();
                return EXIT_USAGE;
        }
    }

    private int accuracy(String[] args) {
        Duration window = null;
        if (args.length > 1) {
            try {
                int days = Integer.parseInt(args[1]);
                if (days <= 0) {
                    err.println("Error: days must be positive");
                    return EXIT_USAGE;
                }
                window = Duration.ofDays(days);
            } catch (NumberFormatException e) {
                err.println("Usage: canary accuracy [days]");
                return EXIT_USAGE;
            }
        }
        Duration since = window;
        return withEngine(intel -> print(intel.accuracyReport(since)));
    }

    private int predict(String[] args) {
        if (args.length < 3) {
            err.println("Usage: canary predict \"headline\" source [contentType]");
            return EXIT_USAGE;
        }
        String contentType = args.length > 3 ? args[3] : Headline.DEFAULT_CONTENT_TYPE;
        Headline headline = Headline.of(args[1], args[2], contentType);
        return withEngine(intel -> print(intel.predict(headline)));
    }

    private int maintain(CanaryIntelligence intel) {
        JobLock locks = intel.jobLock();
        try {
            Optional<JobLock.Handle> handle = locks.tryAcquire(JobType.LEARNING_MAINTENANCE);
            if (handle.isEmpty()) {
                locks.readLockInfo(JobType.LEARNING_MAINTENANCE).ifPresent(info ->
                    err.println("Maintenance already running (PID " + info.pid() + " since " + info.startTime() + ")"));
                return EXIT_BUSY;
            }
            try (JobLock.Handle ignored = handle.get()) {
                MaintenanceResult result = intel.runMaintenance();
                return print(result);
            }
        } catch (IOException e) {
            LOG.error("Cannot take maintenance lock", e);
            err.println("Error: cannot take maintenance lock: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private int withEngine(Command command) {
        try (CanaryIntelligence intel = CanaryIntelligence.open(config)) {
            return command.run(intel);
        }
    }

    private int print(Object value) {
        try {
            out.println(mapper.writeValueAsString(value));
            return EXIT_OK;
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize {}", value.getClass().getSimpleName(), e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
    }

    private void usage() {
        err.println("Usage: canary <command>");
        err.println("  report                       learned-state summary");
        err.println("  accuracy [days]              prediction accuracy");
        err.println("  feedback-summary             feedback counts and learning status");
        err.println("  maintain                     decay stale state, quarantine corrupt rows");
        err.println("  predict \"headline\" source    score a headline");
    }

    @FunctionalInterface
    private interface Command {
        int run(CanaryIntelligence intel);
    }
}
