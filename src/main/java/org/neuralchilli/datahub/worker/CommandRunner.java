package org.neuralchilli.datahub.worker;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.neuralchilli.datahub.core.SubmitRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Runs a submitted payload as a local process.
 * <p>
 * Args are either a JSON command spec,
 * {@code {"command": "spark-submit", "args": ["job.py"], "env": {"DAY": "2024-05-01"}}},
 * or a plain line handed to {@code sh -c}. In trial-run mode nothing is executed.
 */
@ApplicationScoped
public class CommandRunner {

    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    @ConfigProperty(name = "datahub.worker.trial-run", defaultValue = "false")
    boolean trialRun;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /**
     * Command, arguments and extra environment of a payload
     */
    public record CommandSpec(String command, List<String> args, Map<String, String> env) {
        public CommandSpec {
            if (command == null || command.isBlank()) {
                throw new IllegalArgumentException("Command cannot be null or empty");
            }
            args = args != null ? List.copyOf(args) : List.of();
            env = env != null ? Map.copyOf(env) : Map.of();
        }

        List<String> commandLine() {
            List<String> line = new ArrayList<>();
            line.add(command);
            line.addAll(args);
            return line;
        }
    }

    /**
     * Run a request to completion.
     *
     * @param onStart receives the process once started, so it can be destroyed on kill
     */
    public RunResult run(SubmitRequest request, Consumer<Process> onStart) {
        CommandSpec spec;
        try {
            spec = parse(request.args());
        } catch (IllegalArgumentException e) {
            return RunResult.failure("Invalid payload: " + e.getMessage());
        }

        if (trialRun) {
            return trialRun(spec, request);
        }
        return execute(spec, request, onStart);
    }

    CommandSpec parse(String args) {
        String trimmed = args == null ? "" : args.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("empty args");
        }

        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readValue(trimmed, CommandSpec.class);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("args look like JSON but cannot be parsed: "
                        + e.getOriginalMessage(), e);
            }
        }
        return new CommandSpec("sh", List.of("-c", trimmed), Map.of());
    }

    private RunResult trialRun(CommandSpec spec, SubmitRequest request) {
        String commandStr = String.join(" ", spec.commandLine());

        log.info("═══════════════════════════════════════");
        log.info("TRIAL RUN - Would execute:");
        log.info("  Instance: {} [{}]", request.key(), request.taskName());
        log.info("  Mirror: {}", request.mirrorId());
        log.info("  Command: {}", commandStr);
        log.info("  Environment:");
        spec.env().forEach((k, v) -> log.info("    {}={}", k, v));
        log.info("═══════════════════════════════════════");

        return RunResult.success("trial run: " + commandStr);
    }

    private RunResult execute(CommandSpec spec, SubmitRequest request, Consumer<Process> onStart) {
        log.debug("Executing command: {}", String.join(" ", spec.commandLine()));

        try {
            ProcessBuilder pb = new ProcessBuilder(spec.commandLine());
            pb.environment().putAll(spec.env());
            pb.environment().put("DATAHUB_TASK_ID", String.valueOf(request.taskId()));
            pb.environment().put("DATAHUB_CYCLE_ID", request.cycleId());
            pb.environment().put("DATAHUB_ATTEMPT", String.valueOf(request.attempt()));
            pb.environment().put("DATAHUB_MIRROR_ID", String.valueOf(request.mirrorId()));

            // Redirect stderr to stdout for unified logging
            pb.redirectErrorStream(true);

            Process process = pb.start();
            onStart.accept(process);

            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                    log.info("[{}] {}", request.key(), line);
                }
            }

            int exitCode = process.waitFor();
            if (exitCode == 0) {
                return RunResult.success(output.toString().trim());
            }
            return RunResult.failure("exited with code " + exitCode + lastLine(output));

        } catch (IOException e) {
            return RunResult.failure("Failed to start process: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return RunResult.failure("interrupted");
        }
    }

    private String lastLine(StringBuilder output) {
        String text = output.toString().trim();
        if (text.isEmpty()) {
            return "";
        }
        return ": " + text.substring(text.lastIndexOf('\n') + 1);
    }
}
