package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;
import com.williamcallahan.procaudit.service.source.DocumentSource;
import com.williamcallahan.procaudit.service.source.SourceRootPathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests inclusion expansion, its policies and its resolution warnings.
 */
class IncludeExpanderTest {

    private final BlockScanner scanner = new BlockScanner();
    private final Map<String, String> documents = new HashMap<>();
    private final DocumentSource source = path -> {
        String text = documents.get(path);
        if (text == null) {
            throw new NoSuchFileException(path);
        }
        return text;
    };
    private WarningCollector warnings;

    @BeforeEach
    void setUp() {
        warnings = new WarningCollector();
    }

    @Test
    void expand_plainDocument_splicesIncludedBlocks() {
        documents.put("includes/intro.rst", "First.\n\nSecond.\n");

        IncludeExpander.ExpandedDocument expanded = expand(10, "index.rst", "Before.\n\n.. include:: /includes/intro.rst\n");

        assertEquals(IncludePolicy.EXPAND_ALL, expanded.policy());
        List<String> texts = expanded.blocks().stream().map(Block::text).toList();
        assertEquals(List.of("Before.", "First.", "Second."), texts);
        assertTrue(warnings.snapshot().isEmpty());
    }

    @Test
    void expand_relativeTarget_resolvesAgainstIncludingDocument() {
        documents.put("guide/shared/note.rst", "Shared note.\n");

        IncludeExpander.ExpandedDocument expanded = expand(10, "guide/index.rst", ".. include:: shared/note.rst\n");

        assertEquals("Shared note.", expanded.blocks().get(0).text());
    }

    @Test
    void expand_missingTarget_keepsReferenceAsProseWithWarning() {
        IncludeExpander.ExpandedDocument expanded = expand(10, "index.rst", ".. include:: missing.rst\n");

        Block kept = expanded.blocks().get(0);
        assertEquals(BlockKind.PROSE, kept.kind());
        assertEquals(".. include:: missing.rst", kept.text());
        ProcessingWarning warning = warnings.snapshot().get(0);
        assertEquals(WarningType.INCLUDE_NOT_FOUND, warning.type());
        assertEquals(ProcessingWarning.Category.RESOLUTION, warning.category());
        assertEquals(1, warning.line());
    }

    @Test
    void expand_mutualInclusion_reportsCycleOnce() {
        documents.put("b.rst", "From b.\n\n.. include:: a.rst\n");

        IncludeExpander.ExpandedDocument expanded = expand(10, "a.rst", ".. include:: b.rst\n");

        List<ProcessingWarning> reported = warnings.snapshot();
        assertEquals(1, reported.size());
        assertEquals(WarningType.INCLUDE_CYCLE, reported.get(0).type());
        assertEquals("b.rst", reported.get(0).documentPath());
        assertEquals(List.of("From b.", ".. include:: a.rst"),
            expanded.blocks().stream().map(Block::text).toList());
    }

    @Test
    void expand_chainDeeperThanLimit_stopsWithDepthWarning() {
        documents.put("l1.rst", "One.\n\n.. include:: l2.rst\n");
        documents.put("l2.rst", "Two.\n\n.. include:: l3.rst\n");
        documents.put("l3.rst", "Three.\n");

        IncludeExpander.ExpandedDocument expanded = expand(2, "root.rst", ".. include:: l1.rst\n");

        List<ProcessingWarning> reported = warnings.snapshot();
        assertEquals(1, reported.size());
        assertEquals(WarningType.INCLUDE_DEPTH_EXCEEDED, reported.get(0).type());
        assertEquals("l2.rst", reported.get(0).documentPath());
        assertEquals(List.of("One.", "Two.", ".. include:: l3.rst"),
            expanded.blocks().stream().map(Block::text).toList());
    }

    @Test
    void expand_readFailure_abortsWithParsingException() throws IOException {
        DocumentSource failing = mock(DocumentSource.class);
        when(failing.read("other.rst")).thenThrow(new IOException("disk unavailable"));
        IncludeExpander expander = new IncludeExpander(scanner, failing, new SourceRootPathResolver(), 10);
        List<Block> blocks = scanner.scan("index.rst", ".. include:: other.rst\n", warnings);

        ProcedureParsingException thrown = assertThrows(ProcedureParsingException.class,
            () -> expander.expand("index.rst", blocks, warnings));

        assertInstanceOf(IOException.class, thrown.getCause());
    }

    @Test
    void expand_speculativeIncludeWithoutConditionals_becomesSingleProseBlock() {
        documents.put("includes/shared.rst", "Run the installer.\n\nThen restart.\n");

        IncludeExpander.ExpandedDocument expanded = expand(10, "index.rst", composableStep(".. include:: /includes/shared.rst"));

        assertEquals(IncludePolicy.SPECULATIVE, expanded.policy());
        List<Block> stepChildren = stepOf(expanded).children();
        assertEquals(1, stepChildren.size());
        assertEquals(BlockKind.PROSE, stepChildren.get(0).kind());
        assertEquals("Run the installer.\n\nThen restart.", stepChildren.get(0).text());
    }

    @Test
    void expand_speculativeIncludeWithConditionals_splicesConditionalBlocks() {
        documents.put("includes/shared.rst", """
            .. selected-content::
               :selections: python

               Python text.

            .. selected-content::
               :selections: java

               Java text.
            """);

        IncludeExpander.ExpandedDocument expanded = expand(10, "index.rst", composableStep(".. include:: /includes/shared.rst"));

        List<Block> stepChildren = stepOf(expanded).children();
        assertEquals(2, stepChildren.size());
        assertTrue(stepChildren.stream().allMatch(child -> child.is(BlockKind.CONDITIONAL)));
    }

    @Test
    void expand_stepsReference_prefersYamlStepsFile() {
        documents.put("includes/steps-install.yaml", """
            title: Download
            pre: Fetch the archive.
            ---
            title: Unpack
            pre: Extract it.
            """);

        IncludeExpander.ExpandedDocument expanded = expand(10, "index.rst", ".. include:: /includes/steps/install.rst\n");

        Block procedure = expanded.blocks().get(0);
        assertEquals(BlockKind.PROCEDURE, procedure.kind());
        assertEquals(StepsYamlConverter.YAML_MARKER, procedure.marker());
        assertEquals(List.of("Download", "Unpack"), procedure.children().stream().map(Block::argument).toList());
    }

    @Test
    void choosePolicy_followsConditionalAndWrapperPresence() {
        Block conditional = Block.container(BlockKind.CONDITIONAL, 1, "", Map.of("selections", "python"), List.of());
        Block composable = Block.container(BlockKind.COMPOSABLE, 1, "", Map.of(), List.of());

        assertEquals(IncludePolicy.EXPAND_ALL, IncludeExpander.choosePolicy(List.of(Block.prose(1, "Text."))));
        assertEquals(IncludePolicy.CONDITIONAL_SCOPED,
            IncludeExpander.choosePolicy(List.of(composable.withChildren(List.of(conditional)))));
        assertEquals(IncludePolicy.SPECULATIVE, IncludeExpander.choosePolicy(List.of(composable)));
    }

    @Test
    void candidatePaths_stepsDirectory_triesYamlFirst() {
        assertEquals(List.of("includes/steps-install.yaml", "includes/steps/install.rst"),
            IncludeExpander.candidatePaths("includes/steps/install.rst"));
        assertEquals(List.of("includes/install.rst"), IncludeExpander.candidatePaths("includes/install.rst"));
        assertEquals(List.of("includes/mysteps/install.rst"), IncludeExpander.candidatePaths("includes/mysteps/install.rst"));
    }

    private IncludeExpander.ExpandedDocument expand(int maxDepth, String documentPath, String text) {
        IncludeExpander expander = new IncludeExpander(scanner, source, new SourceRootPathResolver(), maxDepth);
        return expander.expand(documentPath, scanner.scan(documentPath, text, warnings), warnings);
    }

    private static String composableStep(String stepBody) {
        return """
            .. composable-tutorial::
               :options: language
               :defaults: python

               .. procedure::

                  .. step:: Install

                     %s
            """.formatted(stepBody);
    }

    private static Block stepOf(IncludeExpander.ExpandedDocument expanded) {
        Block composable = expanded.blocks().get(0);
        Block procedure = composable.children().get(0);
        return procedure.children().get(0);
    }
}
