package org.dxworks.jsxforge;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest {

    @Test
    void missingFileGivesDefaults(@TempDir Path dir) {
        CompilerConfig config = CompilerConfig.load(dir.resolve("jsxforge-config.yml"));

        assertTrue(config.getPassthroughComponents().isEmpty());
        assertEquals("partials/", config.getPartialPrefix());
        assertFalse(config.isPrettyPrint());
        assertTrue(config.isValidateOutput());
        assertEquals(Dialect.HANDLEBARS, config.getDefaultDialect());
    }

    @Test
    void valuesAreReadFromYaml(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("jsxforge-config.yml");
        Files.writeString(file, "passthroughComponents:\n  - Link\n  - ' Image '\n  - ''\n"
                + "partialPrefix: components/\n"
                + "prettyPrint: true\n"
                + "validateOutput: false\n"
                + "defaultDialect: Twig\n");

        CompilerConfig config = CompilerConfig.load(file);

        assertEquals(Set.of("Link", "Image"), config.getPassthroughComponents());
        assertEquals("components/", config.getPartialPrefix());
        assertTrue(config.isPrettyPrint());
        assertFalse(config.isValidateOutput());
        assertEquals(Dialect.TWIG, config.getDefaultDialect());
    }

    @Test
    void missingKeysKeepTheirDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("jsxforge-config.yml");
        Files.writeString(file, "prettyPrint: true\n");

        CompilerConfig config = CompilerConfig.load(file);

        assertTrue(config.isPrettyPrint());
        assertEquals("partials/", config.getPartialPrefix());
        assertTrue(config.isValidateOutput());
    }

    @Test
    void unknownDialectFallsBack(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("jsxforge-config.yml");
        Files.writeString(file, "defaultDialect: jinja\npartialPrefix: parts/\n");

        CompilerConfig config = CompilerConfig.load(file);

        assertEquals(Dialect.HANDLEBARS, config.getDefaultDialect());
        assertEquals("parts/", config.getPartialPrefix());
    }

    @Test
    void unreadableYamlFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("jsxforge-config.yml");
        Files.writeString(file, "prettyPrint: [oops\n");

        CompilerConfig config = CompilerConfig.load(file);

        assertFalse(config.isPrettyPrint());
        assertEquals(Dialect.HANDLEBARS, config.getDefaultDialect());
    }

    @Test
    void withFillsInDefaults() {
        CompilerConfig config = CompilerConfig.with(null, null, true, false, null);

        assertTrue(config.getPassthroughComponents().isEmpty());
        assertEquals("partials/", config.getPartialPrefix());
        assertEquals(Dialect.HANDLEBARS, config.getDefaultDialect());
    }
}
