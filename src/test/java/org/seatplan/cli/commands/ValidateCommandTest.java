package org.seatplan.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.seatplan.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ValidateCommandTest {

    @Test
    void validate_printsStatistics(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("wedding.json");
        Files.writeString(file, """
            {
              "people": [
                { "name": "A", "preferences": ["B", "C"] },
                { "name": "B", "preferences": ["A"] },
                { "name": "C" }
              ],
              "tables": [2, 1],
              "plusOnes": [ { "personOne": "A", "personTwo": "B" } ]
            }
            """);
        CommandLine cmd = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("validate", "-f", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .contains("is valid")
                .containsPattern("People:\\s+3")
                .containsPattern("Seats:\\s+3")
                .containsPattern("Preferences:\\s+3")
                .containsPattern("Companion pairs:\\s+1");
    }

    @Test
    void validate_reportsInvalidProblem(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("broken.json");
        Files.writeString(file, "{ \"people\": [ { \"name\": \"A\" }, { \"name\": \"A\" } ], \"tables\": [2] }");
        CommandLine cmd = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err));

        int exitCode = cmd.execute("validate", "-f", file.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Duplicate person name: 'A'");
    }
}
