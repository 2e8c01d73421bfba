package com.circuitsync.core.document;

import com.circuitsync.core.config.SyncConfig.DocumentSettings;
import com.circuitsync.core.model.AnnotationKind;
import com.circuitsync.core.model.IssueKind;
import com.circuitsync.core.model.Position;
import com.circuitsync.core.model.SyncIssue;
import com.circuitsync.core.sexpr.SNode.SList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ProjectStore}.
 */
class ProjectStoreTest {

    private static final String ROOT = """
        (kicad_sch
        \t(version 20231120)
        \t(generator "eeschema")
        \t(uuid "11111111-0000-4000-8000-000000000001")
        \t(paper "A4")
        \t(lib_symbols)
        \t(sheet
        \t\t(at 50 50)
        \t\t(size 25.4 12.7)
        \t\t(uuid "11111111-0000-4000-8000-000000000002")
        \t\t(property "Sheetname" "filter"
        \t\t\t(at 50 49.2884 0)
        \t\t)
        \t\t(property "Sheetfile" "filter.kicad_sch"
        \t\t\t(at 50 63.2846 0)
        \t\t)
        \t)
        )
        """;

    private static final String CHILD = """
        (kicad_sch
        \t(version 20231120)
        \t(generator "eeschema")
        \t(uuid "11111111-0000-4000-8000-000000000002")
        \t(paper "A4")
        \t(lib_symbols)
        )
        """;

    @TempDir
    Path tempDir;

    private final ProjectStore store = new ProjectStore(DocumentSettings.defaults());

    @Test
    void load_missingRoot_createsNewInMemoryProject() {
        ProjectStore.LoadResult result = store.load(tempDir, "amp");

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.project().root().isNew()).isTrue();
        assertThat(result.project().rootFileName()).isEqualTo("amp.kicad_sch");
        assertThat(tempDir.resolve("amp.kicad_sch")).doesNotExist();
    }

    @Test
    void load_rootWithSheet_followsSheetFile() throws IOException {
        Files.writeString(tempDir.resolve("amp.kicad_sch"), ROOT);
        Files.writeString(tempDir.resolve("filter.kicad_sch"), CHILD);

        ProjectStore.LoadResult result = store.load(tempDir, "amp");

        assertThat(result.issues()).isEmpty();
        assertThat(result.project().fragments()).extracting(SchematicDocument::fileName)
            .containsExactly("amp.kicad_sch", "filter.kicad_sch");
    }

    @Test
    void load_malformedChild_reportsFormatError() throws IOException {
        Files.writeString(tempDir.resolve("amp.kicad_sch"), ROOT);
        Files.writeString(tempDir.resolve("filter.kicad_sch"), "(kicad_sch (version 20231120)");

        ProjectStore.LoadResult result = store.load(tempDir, "amp");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.FORMAT_ERROR);
            assertThat(issue.entity()).isEqualTo("filter.kicad_sch");
        });
    }

    @Test
    void load_malformedRoot_returnsNoProject() throws IOException {
        Files.writeString(tempDir.resolve("amp.kicad_sch"), "not a schematic");

        ProjectStore.LoadResult result = store.load(tempDir, "amp");

        assertThat(result.project()).isNull();
        assertThat(result.hasErrors()).isTrue();
    }

    @Test
    void load_rootNotUtf8_reportsFormatErrorInsteadOfThrowing() throws IOException {
        // Given: a Latin-1 encoded value
        byte[] latin1 = ROOT.replace("\"A4\"", "\"Résumé\"").getBytes(StandardCharsets.ISO_8859_1);
        Files.write(tempDir.resolve("amp.kicad_sch"), latin1);

        // When
        ProjectStore.LoadResult result = store.load(tempDir, "amp");

        // Then
        assertThat(result.project()).isNull();
        assertThat(result.issues()).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.FORMAT_ERROR);
            assertThat(issue.entity()).isEqualTo("amp.kicad_sch");
            assertThat(issue.message()).contains("Invalid UTF-8");
        });
    }

    @Test
    void load_childNotUtf8_reportsFormatError() throws IOException {
        Files.writeString(tempDir.resolve("amp.kicad_sch"), ROOT);
        Files.write(tempDir.resolve("filter.kicad_sch"),
            CHILD.replace("\"A4\"", "\"é\"").getBytes(StandardCharsets.ISO_8859_1));

        ProjectStore.LoadResult result = store.load(tempDir, "amp");

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.issues()).extracting(SyncIssue::entity).containsExactly("filter.kicad_sch");
    }

    @Test
    void write_unchangedProject_writesNothing() throws IOException {
        Path root = tempDir.resolve("amp.kicad_sch");
        Files.writeString(root, ROOT);
        Files.writeString(tempDir.resolve("filter.kicad_sch"), CHILD);
        ProjectDocument project = store.load(tempDir, "amp").project();

        ProjectStore.WriteResult result = store.write(project);

        assertThat(result.written()).isEmpty();
        assertThat(result.deleted()).isEmpty();
        assertThat(Files.readString(root)).isEqualTo(ROOT);
    }

    @Test
    void write_editedFragment_replacesFileAndLeavesNoTempFiles() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("amp.kicad_sch"), ROOT);
        Files.writeString(tempDir.resolve("filter.kicad_sch"), CHILD);
        ProjectDocument project = store.load(tempDir, "amp").project();
        SList label = SchematicElements.label(AnnotationKind.LOCAL_LABEL, "X",
            Position.at(BigDecimal.TEN, BigDecimal.TEN), "11111111-0000-4000-8000-000000000003");
        project.root().add(label);

        // When
        ProjectStore.WriteResult result = store.write(project);

        // Then
        assertThat(result.written()).containsExactly("amp.kicad_sch");
        assertThat(Files.readString(tempDir.resolve("amp.kicad_sch"))).contains("(label \"X\"");
        assertThat(Files.readString(tempDir.resolve("filter.kicad_sch"))).isEqualTo(CHILD);
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()).toList())
                .containsExactlyInAnyOrder("amp.kicad_sch", "filter.kicad_sch");
        }
        assertThat(project.root().needsWrite()).isFalse();
    }

    @Test
    void write_removedFragment_deletesFile() throws IOException {
        Files.writeString(tempDir.resolve("amp.kicad_sch"), ROOT);
        Files.writeString(tempDir.resolve("filter.kicad_sch"), CHILD);
        ProjectDocument project = store.load(tempDir, "amp").project();
        SList sheet = project.root().elements(SchematicElements.SHEET).get(0);
        project.root().remove(sheet);
        project.removeFragment("filter.kicad_sch");

        ProjectStore.WriteResult result = store.write(project);

        assertThat(result.deleted()).containsExactly("filter.kicad_sch");
        assertThat(tempDir.resolve("filter.kicad_sch")).doesNotExist();
        assertThat(project.removedFragments()).isEmpty();
    }

    @Test
    void write_moveFails_removesRemainingTempFiles() throws IOException {
        // Given: both fragments edited, the root target blocked by a non-empty directory
        Files.writeString(tempDir.resolve("amp.kicad_sch"), ROOT);
        Files.writeString(tempDir.resolve("filter.kicad_sch"), CHILD);
        ProjectDocument project = store.load(tempDir, "amp").project();
        Position at = Position.at(BigDecimal.TEN, BigDecimal.TEN);
        project.root().add(SchematicElements.label(AnnotationKind.LOCAL_LABEL, "X", at,
            "11111111-0000-4000-8000-000000000003"));
        project.fragment("filter.kicad_sch").orElseThrow().add(SchematicElements.label(AnnotationKind.LOCAL_LABEL,
            "Y", at, "11111111-0000-4000-8000-000000000004"));
        Files.delete(tempDir.resolve("amp.kicad_sch"));
        Files.createDirectories(tempDir.resolve("amp.kicad_sch/blocker"));

        // When
        assertThatThrownBy(() -> store.write(project)).isInstanceOf(UncheckedIOException.class);

        // Then
        try (var files = Files.list(tempDir)) {
            assertThat(files.map(p -> p.getFileName().toString()).toList())
                .containsExactlyInAnyOrder("amp.kicad_sch", "filter.kicad_sch");
        }
        assertThat(Files.readString(tempDir.resolve("filter.kicad_sch"))).isEqualTo(CHILD);
    }

    @Test
    void removeFragment_root_throwsException() {
        ProjectDocument project = store.load(tempDir, "amp").project();

        assertThatThrownBy(() -> project.removeFragment("amp.kicad_sch"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(List.copyOf(project.fragments())).hasSize(1);
    }
}
