package com.tiergate.config;

import com.tiergate.core.RunOptions;
import com.tiergate.core.Tier;
import com.tiergate.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    private static GateConfig parse(String yaml) {
        InputStream in = new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
        return ConfigLoader.parse(in);
    }

    // ==================== Loading ====================

    @Test
    @DisplayName("Should load a classpath configuration")
    void shouldLoadFromClasspath() {
        GateConfig config = ConfigLoader.load("classpath:tiergate-test.yaml");

        assertEquals("test-gate", config.name());

        ExecutionConfig execution = config.execution();
        assertEquals(10000, execution.timeoutMs());
        assertFalse(execution.fallbackToSequential());
        assertTrue(execution.verbose());
        assertEquals(250, execution.killGraceMs());
        assertEquals("/tmp", execution.workingDirectory());

        assertEquals(4500, config.defaultTimeoutMs(Tier.HIGH));
        assertEquals(Tier.MEDIUM.defaultTimeoutMs(), config.defaultTimeoutMs(Tier.MEDIUM));

        assertEquals(2, config.families().size());
        assertEquals(Tier.LOW, config.getFamily("code_cleanup").orElseThrow().tier());

        assertEquals(2, config.catalog().size());
        CatalogEntry janitor = config.getCatalogEntry("node tools/hooks/cleanup/import-janitor.js").orElseThrow();
        assertNull(janitor.tier());
        assertNull(janitor.timeoutMs());
        assertEquals(4000L, config.getCatalogEntry("node tools/hooks/security/security-scan.js")
                .orElseThrow().timeoutMs());
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadBundledConfig() {
        GateConfig config = ConfigLoader.load("classpath:tiergate.yaml");

        assertEquals("hook-gate", config.name());
        assertTrue(config.execution().fallbackToSequential());
        assertEquals(11, config.families().size());
        assertEquals(20, config.catalog().size());
    }

    @Test
    @DisplayName("Should load a file system configuration")
    void shouldLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("gate.yaml");
        Files.writeString(file, "name: file-gate\n");

        GateConfig config = ConfigLoader.load(file.toString());

        assertEquals("file-gate", config.name());
        assertEquals(RunOptions.DEFAULT_TIMEOUT_MS, config.execution().timeoutMs());
        assertTrue(config.catalog().isEmpty());
    }

    @Test
    @DisplayName("Should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("classpath:does-not-exist.yaml"));
        assertThrows(ConfigurationException.class, () -> ConfigLoader.load("/does/not/exist.yaml"));
    }

    // ==================== Validation ====================

    @Test
    @DisplayName("Should reject unknown tier labels")
    void shouldRejectUnknownTier() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> parse("tiergate:\n  families:\n    - name: x\n      tier: urgent\n"));
        assertTrue(e.getMessage().contains("urgent"));

        assertThrows(ConfigurationException.class,
                () -> parse("tiergate:\n  tiers:\n    urgent:\n      timeout-ms: 100\n"));
    }

    @Test
    @DisplayName("Should reject duplicate families")
    void shouldRejectDuplicateFamilies() {
        assertThrows(ConfigurationException.class,
                () -> parse("families:\n  - name: x\n  - name: x\n"));
    }

    @Test
    @DisplayName("Should reject catalog entries without a command")
    void shouldRejectCatalogWithoutCommand() {
        assertThrows(ConfigurationException.class,
                () -> parse("tasks:\n  - tier: high\n"));
    }

    @Test
    @DisplayName("Should reject non-positive timeouts and negative kill grace")
    void shouldRejectBadNumbers() {
        assertThrows(ConfigurationException.class,
                () -> parse("tasks:\n  - command: x\n    timeout-ms: 0\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("tiers:\n  low:\n    timeout-ms: -1\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("execution:\n  kill-grace-ms: -1\n"));
        assertThrows(ConfigurationException.class,
                () -> parse("execution:\n  timeout-ms: soon\n"));
    }

    @Test
    @DisplayName("Should reject empty and malformed documents")
    void shouldRejectMalformed() {
        assertThrows(ConfigurationException.class, () -> parse(""));
        assertThrows(ConfigurationException.class, () -> parse("- just\n- a list\n"));
        assertThrows(ConfigurationException.class, () -> parse("tiergate: [unclosed\n"));
    }
}
