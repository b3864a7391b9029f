package com.example.toolgate.tools.shell;

import com.example.toolgate.host.InMemorySettingsStore;
import com.example.toolgate.host.SettingKey;
import com.example.toolgate.tools.RiskLevel;
import com.example.toolgate.tools.ToolErrorKind;
import com.example.toolgate.tools.ToolException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ShellToolProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void returnsCommandOutput() throws Exception {
        ShellToolProvider provider = new ShellToolProvider(new InMemorySettingsStore());

        String output = provider.invoke(ShellToolProvider.EXECUTE,
                mapper.createObjectNode().put("command", "echo hello")).content();

        assertEquals("```\nhello\n\n```", output);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void includesStderrAndExitCode() throws Exception {
        ShellToolProvider provider = new ShellToolProvider(new InMemorySettingsStore());

        String output = provider.invoke(ShellToolProvider.EXECUTE,
                mapper.createObjectNode().put("command", "echo oops >&2; exit 3")).content();

        assertTrue(output.contains("stderr: oops"));
        assertTrue(output.contains("(exit code: 3)"));
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void killsCommandsThatOverrunTheCap() {
        InMemorySettingsStore settings = new InMemorySettingsStore();
        settings.set(SettingKey.SHELL_TIMEOUT_SECONDS, "1");
        ShellToolProvider provider = new ShellToolProvider(settings);

        ToolException error = assertThrows(ToolException.class, () -> provider.invoke(ShellToolProvider.EXECUTE,
                mapper.createObjectNode().put("command", "sleep 10").put("timeout", 60)));

        assertEquals(ToolErrorKind.API_ERROR, error.getKind());
        assertEquals("Command timed out after 1 seconds", error.getMessage());
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void timeoutAlsoKillsChildrenOfTheShell(@TempDir Path tempDir) throws Exception {
        InMemorySettingsStore settings = new InMemorySettingsStore();
        settings.set(SettingKey.SHELL_TIMEOUT_SECONDS, "1");
        ShellToolProvider provider = new ShellToolProvider(settings);
        Path pidFile = tempDir.resolve("child.pid");
        String command = "sh -c 'echo $$ > " + pidFile + "; exec sleep 60' | cat";

        assertThrows(ToolException.class, () -> provider.invoke(ShellToolProvider.EXECUTE,
                mapper.createObjectNode().put("command", command)));

        long pid = Long.parseLong(Files.readString(pidFile).trim());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (isAlive(pid) && System.nanoTime() < deadline) {
            Thread.sleep(50);
        }
        assertFalse(isAlive(pid), "sleep child should be killed with the shell");
    }

    // A killed child may linger as a zombie until its new parent reaps it.
    private static boolean isAlive(long pid) throws IOException {
        Path stat = Path.of("/proc", Long.toString(pid), "stat");
        if (!Files.exists(stat)) {
            return false;
        }
        String content;
        try {
            content = Files.readString(stat);
        } catch (NoSuchFileException e) {
            return false;
        }
        String afterName = content.substring(content.lastIndexOf(')') + 1).trim();
        return !afterName.startsWith("Z");
    }

    @Test
    void formatsEmptyAndOversizedOutput() {
        assertEquals("```\n(no output)\n```", ShellToolProvider.format("", "", 0));

        String huge = ShellToolProvider.format("x".repeat(9000), "", 0);
        assertTrue(huge.endsWith("\n...(truncated)\n```"));
        assertEquals(8000 + "```\n".length() + "\n...(truncated)".length() + "\n```".length(), huge.length());
    }

    @Test
    void isRestricted() {
        assertEquals(RiskLevel.RESTRICTED, new ShellToolProvider(null).descriptors().get(0).risk());
    }
}
