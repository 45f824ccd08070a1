package com.whitehall;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link WhitehallCLI}.
 */
class WhitehallCLITest {

    private final PrintStream originalOut = System.out;
    private ByteArrayOutputStream out;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
    }

    @Test
    void execute_withoutSubcommand_printsUsageHint() {
        // When
        int exitCode = WhitehallCLI.commandLine().execute();

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).contains("Use 'whitehall --help'");
    }

    @Test
    void execute_quiet_printsNothing() {
        // When
        int exitCode = WhitehallCLI.commandLine().execute("-q");

        // Then
        assertThat(exitCode).isZero();
        assertThat(out.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void parseArgs_globalOptions_areBound() {
        // Given
        WhitehallCLI cli = new WhitehallCLI();

        // When
        new CommandLine(cli).parseArgs("--verbose");

        // Then
        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void commandLine_registersSubcommands() {
        // When
        CommandLine commandLine = WhitehallCLI.commandLine();

        // Then
        assertThat(commandLine.getSubcommands()).containsOnlyKeys("compile", "check", "list");
    }
}
