package com.circuitsync.cli;

import com.circuitsync.CircuitSyncCLI;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the {@code sync}, {@code diff} and {@code validate} commands.
 */
class SyncCommandTest {

    private static final String DEVICE_LIBRARY = """
        (kicad_symbol_lib
        \t(version 20231120)
        \t(symbol "R"
        \t\t(property "Reference" "R" (at 2.032 0 90))
        \t\t(property "Value" "R" (at 0 0 90))
        \t\t(symbol "R_1_1"
        \t\t\t(pin passive line (at 0 3.81 270) (length 1.27) (name "~") (number "1"))
        \t\t\t(pin passive line (at 0 -3.81 90) (length 1.27) (name "~") (number "2"))
        \t\t)
        \t)
        )
        """;

    private static final String DESCRIPTION = """
        components:
          - ref: R1
            type: Device:R
            id: top
            properties:
              Value: 10k
          - ref: R2
            type: Device:R
            id: bottom
        nets:
          - name: SIG
            connect: [R1.1, R2.1]
          - name: GND
            power: true
            connect: [R1.2, R2.2]
        """;

    @TempDir
    Path tempDir;

    private Path projectDir;
    private Path descriptionFile;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private PrintStream originalOut;
    private PrintStream originalErr;

    @BeforeEach
    void setUp() throws IOException {
        Path libraries = Files.createDirectories(tempDir.resolve("symbols"));
        Files.writeString(libraries.resolve("Device.kicad_sym"), DEVICE_LIBRARY);
        projectDir = Files.createDirectories(tempDir.resolve("board"));
        Files.writeString(projectDir.resolve("circuitsync.yaml"), """
            library:
              paths:
                - ../symbols
            sync:
              projectName: amp
            """);
        descriptionFile = tempDir.resolve("amp.yaml");
        Files.writeString(descriptionFile, DESCRIPTION);

        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreStreams() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    @Test
    void sync_validDescription_writesProjectAndPrintsReport() throws IOException {
        // When
        int exitCode = execute("sync", descriptionFile.toString(), projectDir.toString());

        // Then
        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"success\" : true", "\"fragmentsWritten\" : [ \"amp.kicad_sch\" ]");
        String schematic = Files.readString(projectDir.resolve("amp.kicad_sch"));
        assertThat(schematic).contains("(lib_id \"Device:R\")", "(label \"SIG\"", "(global_label \"GND\"");
    }

    @Test
    void sync_dryRun_writesNothing() throws IOException {
        int exitCode = execute("sync", "--dry-run", descriptionFile.toString(), projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("\"dryRun\" : true");
        try (Stream<Path> files = Files.list(projectDir)) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("circuitsync.yaml");
        }
    }

    @Test
    void sync_duplicateReference_exitsWithErrorAndWritesNothing() throws IOException {
        Files.writeString(descriptionFile, """
            components:
              - ref: R1
                type: Device:R
              - ref: R1
                type: Device:R
            """);

        int exitCode = execute("sync", descriptionFile.toString(), projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("IDENTITY_CONFLICT", "no file was written");
        assertThat(projectDir.resolve("amp.kicad_sch")).doesNotExist();
    }

    @Test
    void sync_missingDescription_exitsWithError() {
        int exitCode = execute("sync", tempDir.resolve("missing.yaml").toString(), projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("Sync failed");
    }

    @Test
    void diff_afterSync_reportsUpToDate() {
        execute("sync", descriptionFile.toString(), projectDir.toString());
        out.reset();

        int exitCode = execute("diff", descriptionFile.toString(), projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Project is up to date").doesNotContain("would write");
    }

    @Test
    void diff_freshProject_listsPendingFragments() {
        int exitCode = execute("diff", descriptionFile.toString(), projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("Components", "+2", "would write  amp.kicad_sch", "Changes pending");
    }

    @Test
    void validate_malformedRoot_exitsWithError() throws IOException {
        Files.writeString(projectDir.resolve("amp.kicad_sch"), "(kicad_sch (version 20231120)");

        int exitCode = execute("validate", projectDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(stderr()).contains("FORMAT_ERROR");
    }

    @Test
    void validate_syncedProject_parsesEveryFragment() {
        execute("sync", descriptionFile.toString(), projectDir.toString());
        out.reset();

        int exitCode = execute("validate", projectDir.toString());

        assertThat(exitCode).isZero();
        assertThat(stdout()).contains("1 fragment(s) parsed");
    }

    private int execute(String... args) {
        return CircuitSyncCLI.commandLine().execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
