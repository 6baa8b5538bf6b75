package com.autodev.coordinator.worker;

import com.autodev.coordinator.config.CoordinatorProperties;
import com.autodev.coordinator.model.Task;
import com.autodev.coordinator.service.RateLimitDetector;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs the configured agent CLI once per task.
 *
 * The prompt (context block, task type and payload) is fed to the process's
 * stdin from a temp file; stdout and stderr are captured together. The
 * process is killed when it outlives autodev.worker.timeout. A non-zero exit whose output
 * looks like a provider rate limit is reported as rate-limited rather than
 * failed, so the task goes back to the queue instead of burning a retry.
 */
@Component
public class CommandTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(CommandTaskHandler.class);

    // Tail of the output kept in result_json / error.
    static final int MAX_OUTPUT_CHARS = 4000;

    private final CoordinatorProperties props;
    private final ObjectMapper          json;
    private final Clock                 clock;

    public CommandTaskHandler(CoordinatorProperties props, ObjectMapper objectMapper, Clock clock) {
        this.props = props;
        this.json  = objectMapper;
        this.clock = clock;
    }

    @Override
    public HandlerResult execute(Task task, String provider, String context) throws IOException, InterruptedException {
        List<String> command = props.getWorker().getCommand();
        Duration timeout = props.getWorker().getTimeout();

        File inFile  = File.createTempFile("autodev-prompt-", ".md");
        File outFile = File.createTempFile("autodev-task-", ".log");
        try {
            // The prompt is read from a file, so no write to the child can block past the timeout.
            Files.writeString(inFile.toPath(), prompt(task, context), StandardCharsets.UTF_8);
            ProcessBuilder pb = new ProcessBuilder(command)
                    .redirectInput(inFile)
                    .redirectErrorStream(true)
                    .redirectOutput(outFile);
            pb.environment().put("AUTODEV_PROVIDER",  provider);
            pb.environment().put("AUTODEV_TASK_ID",   task.getId().toString());
            pb.environment().put("AUTODEV_TASK_TYPE", task.getType());
            if (task.getRepoRef() != null) {
                pb.environment().put("AUTODEV_REPO_REF", task.getRepoRef());
            }

            log.info("Running {} for task {} (provider={}, timeout={})", command, task.getId(), provider, timeout);
            Process process = pb.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(10, TimeUnit.SECONDS);
            }
            String output = tail(Files.readString(outFile.toPath(), StandardCharsets.UTF_8));

            if (!finished) {
                return HandlerResult.failure("timed out after " + timeout + "\n" + output);
            }
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return HandlerResult.success(resultJson(exitCode, output), output);
            }
            Optional<Instant> resetAt = RateLimitDetector.detect(
                    output, clock.instant(), props.getProviders().getDefaultLimitDuration());
            if (resetAt.isPresent()) {
                return HandlerResult.rateLimited(resetAt.get(), output);
            }
            return HandlerResult.failure("exit code " + exitCode + "\n" + output);
        } finally {
            Files.deleteIfExists(inFile.toPath());
            Files.deleteIfExists(outFile.toPath());
        }
    }

    String prompt(Task task, String context) {
        StringBuilder sb = new StringBuilder();
        if (context != null && !context.isBlank()) {
            sb.append(context).append('\n');
        }
        sb.append("## Task\n\n")
          .append("Type: ").append(task.getType()).append('\n')
          .append("Id: ").append(task.getId()).append('\n');
        if (task.getRepoRef() != null) {
            sb.append("Repository: ").append(task.getRepoRef()).append('\n');
        }
        if (task.getPayloadJson() != null) {
            sb.append("\nPayload:\n").append(task.getPayloadJson()).append('\n');
        }
        return sb.toString();
    }

    private String resultJson(int exitCode, String output) {
        ObjectNode node = json.createObjectNode();
        node.put("exit_code", exitCode);
        node.put("output", output);
        try {
            return json.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    static String tail(String output) {
        return output.length() <= MAX_OUTPUT_CHARS ? output : output.substring(output.length() - MAX_OUTPUT_CHARS);
    }
}
