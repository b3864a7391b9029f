package com.example.toolgate.tools.shell;

import com.example.toolgate.host.SettingKey;
import com.example.toolgate.host.SettingsStore;
import com.example.toolgate.tools.InputSchema;
import com.example.toolgate.tools.RiskLevel;
import com.example.toolgate.tools.ToolArguments;
import com.example.toolgate.tools.ToolCategory;
import com.example.toolgate.tools.ToolDescriptor;
import com.example.toolgate.tools.ToolException;
import com.example.toolgate.tools.ToolProvider;
import com.example.toolgate.tools.ToolResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class ShellToolProvider implements ToolProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ShellToolProvider.class);

    public static final ToolCategory CATEGORY = new ToolCategory("shell", "Run shell commands on this machine.");

    static final String EXECUTE = "shell.execute";
    static final int DEFAULT_TIMEOUT_SECONDS = 20;
    static final int MAX_OUTPUT_LENGTH = 8000;

    private final SettingsStore settings;
    private final List<String> shellPrefix;
    private final ExecutorService streamReaders = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "shell-output-reader");
        thread.setDaemon(true);
        return thread;
    });

    public ShellToolProvider(SettingsStore settings) {
        this(settings, List.of("/bin/sh", "-c"));
    }

    ShellToolProvider(SettingsStore settings, List<String> shellPrefix) {
        this.settings = settings;
        this.shellPrefix = List.copyOf(shellPrefix);
    }

    @Override
    public List<ToolDescriptor> descriptors() {
        return List.of(ToolDescriptor.builder(EXECUTE, CATEGORY)
                .description("Execute a shell command and return its output. Commands are killed after the configured timeout.")
                .schema(InputSchema.builder()
                        .string("command", "Shell command to run", true)
                        .integer("timeout", "Timeout in seconds; capped by the configured maximum", false)
                        .build())
                .risk(RiskLevel.RESTRICTED)
                .build());
    }

    @Override
    public ToolResult invoke(String name, JsonNode arguments) throws ToolException {
        if (!EXECUTE.equals(name)) {
            throw ToolException.unknownTool(name);
        }
        String command = ToolArguments.requireText(arguments, "command");
        int cap = settings == null
                ? DEFAULT_TIMEOUT_SECONDS
                : settings.getInt(SettingKey.SHELL_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS);
        int requested = arguments.path("timeout").asInt(cap);
        int timeoutSeconds = Math.max(1, Math.min(requested, cap));

        LOGGER.info("Running shell command with {}s timeout", timeoutSeconds);
        return run(command, timeoutSeconds);
    }

    private ToolResult run(String command, int timeoutSeconds) throws ToolException {
        List<String> argv = new ArrayList<>(shellPrefix);
        argv.add(command);
        Process process;
        try {
            process = new ProcessBuilder(argv).start();
            process.getOutputStream().close();
        } catch (IOException e) {
            throw ToolException.apiError("Failed to start command: " + e.getMessage(), e);
        }

        Future<String> stdout = streamReaders.submit(() -> read(process.getInputStream()));
        Future<String> stderr = streamReaders.submit(() -> read(process.getErrorStream()));
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                terminate(process, stdout, stderr);
                LOGGER.warn("Shell command timed out after {}s", timeoutSeconds);
                throw ToolException.apiError("Command timed out after " + timeoutSeconds + " seconds");
            }
            String out = stdout.get(5, TimeUnit.SECONDS);
            String err = stderr.get(5, TimeUnit.SECONDS);
            return ToolResult.success(format(out, err, process.exitValue()));
        } catch (InterruptedException e) {
            terminate(process, stdout, stderr);
            Thread.currentThread().interrupt();
            throw ToolException.apiError("Command interrupted", e);
        } catch (ExecutionException | TimeoutException e) {
            terminate(process, stdout, stderr);
            throw ToolException.apiError("Failed to read command output: " + e.getMessage(), e);
        }
    }

    // Children of the shell keep the output pipes open, so they are killed before the shell.
    private static void terminate(Process process, Future<String> stdout, Future<String> stderr) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        stdout.cancel(true);
        stderr.cancel(true);
    }

    static String format(String stdout, String stderr, int exitCode) {
        StringBuilder output = new StringBuilder(stdout);
        if (!stderr.isEmpty()) {
            if (output.length() > 0) {
                output.append('\n');
            }
            output.append("stderr: ").append(stderr);
        }
        if (exitCode != 0) {
            output.append("\n(exit code: ").append(exitCode).append(')');
        }
        String text = output.length() == 0 ? "(no output)" : output.toString();
        if (text.length() > MAX_OUTPUT_LENGTH) {
            text = text.substring(0, MAX_OUTPUT_LENGTH) + "\n...(truncated)";
        }
        return "```\n" + text + "\n```";
    }

    private static String read(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
