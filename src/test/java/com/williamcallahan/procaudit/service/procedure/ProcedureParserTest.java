package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.AnalysisEntry;
import com.williamcallahan.procaudit.domain.procedure.ExtractionUnit;
import com.williamcallahan.procaudit.domain.procedure.MarkerType;
import com.williamcallahan.procaudit.domain.procedure.Procedure;
import com.williamcallahan.procaudit.domain.procedure.ProcedureFormat;
import com.williamcallahan.procaudit.domain.procedure.ProcedureParseResult;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;
import com.williamcallahan.procaudit.domain.procedure.Step;
import com.williamcallahan.procaudit.domain.procedure.Variation;
import com.williamcallahan.procaudit.service.source.DocumentSource;
import com.williamcallahan.procaudit.service.source.SourceRootPathResolver;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * End-to-end tests of the parsing pipeline over in-memory documents.
 */
class ProcedureParserTest {

    private static final String DIRECTIVE_INSTALL = """
        Install
        =======

        .. procedure::

           .. step:: Download the archive

              Fetch it from the site.

           .. step:: Unpack it

              Run tar.
        """;

    private static final String LIST_INSTALL = """
        Install
        =======

        1. Download the archive

           Fetch it from the site.

        2. Unpack it

           Run tar.
        """;

    private final Map<String, String> documents = new HashMap<>();
    private final DocumentSource source = path -> {
        String text = documents.get(path);
        if (text == null) {
            throw new NoSuchFileException(path);
        }
        return text;
    };
    private final ProcedureParser parser =
        new ProcedureParser(source, new SourceRootPathResolver(), ProcedureParserSettings.defaults());

    @Test
    void parse_sameInputTwice_producesEqualResults() {
        ProcedureParseResult first = parser.parse("index.rst", DIRECTIVE_INSTALL);
        ProcedureParseResult second = parser.parse("index.rst", DIRECTIVE_INSTALL);

        assertEquals(first.procedures(), second.procedures());
        assertEquals(first.analysis(), second.analysis());
        assertEquals(first.extraction(), second.extraction());
        assertTrue(first.isClean());
    }

    @Test
    void parse_directiveAndOrderedList_yieldSameStepsAndHash() {
        Procedure directive = parser.parse("a.rst", DIRECTIVE_INSTALL).procedures().get(0);
        Procedure list = parser.parse("b.rst", LIST_INSTALL).procedures().get(0);

        assertEquals(ProcedureFormat.DIRECTIVE, directive.format());
        assertEquals(ProcedureFormat.ORDERED_LIST, list.format());
        assertEquals("Install", directive.heading());
        assertEquals("Install", list.heading());
        assertEquals(List.of("Download the archive", "Unpack it"), titles(directive));
        assertEquals(titles(directive), titles(list));
        assertEquals("Fetch it from the site.", directive.steps().get(0).content());
        assertEquals(directive.steps().get(0).content(), list.steps().get(0).content());
        assertEquals(directive.hash(), list.hash());
    }

    @Test
    void parse_changedStepBody_changesHash() {
        String changed = DIRECTIVE_INSTALL.replace("Run tar.", "Run unzip.");

        assertNotEquals(
            parser.parse("index.rst", DIRECTIVE_INSTALL).procedures().get(0).hash(),
            parser.parse("index.rst", changed).procedures().get(0).hash());
    }

    @Test
    void parse_continuationMarkers_formOneProcedure() {
        ProcedureParseResult result = parser.parse("index.rst", "1. First\n#. Second\n#. Third\n");

        assertEquals(1, result.procedures().size());
        assertEquals(List.of("First", "Second", "Third"), titles(result.procedures().get(0)));
        assertTrue(result.isClean());
    }

    @Test
    void parse_tabsHoldingProcedures_splitIntoOneProcedurePerTab() {
        String text = """
            Connect
            =======

            .. tabs::

               .. tab::
                  :tabid: shell

                  1. Open a shell.
                  2. Run connect.

               .. tab::
                  :tabid: compass

                  1. Open Compass.
                  2. Click connect.

               .. tab::
                  :tabid: python

                  1. Import the driver.
                  2. Call connect.
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(3, result.procedures().size());
        assertEquals(1, result.tabSets().size());
        assertEquals(List.of("shell", "compass", "python"), result.tabSets().get(0).tabIds());
        for (Procedure procedure : result.procedures()) {
            assertEquals("Connect", procedure.heading());
            assertSame(result.tabSets().get(0), procedure.tabSet());
            assertEquals(List.of(procedure.tabId()), procedure.variations());
            assertEquals(2, procedure.steps().size());
        }
        assertEquals(1, result.analysis().size());
        assertEquals(3, result.analysis().get(0).appearanceCount());
        assertEquals(3, result.extraction().size());
    }

    @Test
    void parse_tabSetInsideWrapperSelection_keepsTabSetAndCombinesLabels() {
        String text = """
            Connect
            =======

            .. composable-tutorial::
               :options: deployment
               :defaults: atlas

               .. selected-content::
                  :selections: atlas

                  .. tabs::

                     .. tab::
                        :tabid: shell

                        1. Open a shell.
                        2. Run connect.

                     .. tab::
                        :tabid: compass

                        1. Open Compass.
                        2. Click connect.
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.tabSets().size());
        assertEquals(List.of("shell", "compass"), result.tabSets().get(0).tabIds());
        assertEquals(2, result.procedures().size());
        Procedure shell = result.procedures().get(0);
        Procedure compass = result.procedures().get(1);
        assertSame(result.tabSets().get(0), shell.tabSet());
        assertSame(result.tabSets().get(0), compass.tabSet());
        assertEquals("shell", shell.tabId());
        assertEquals(List.of("deployment=atlas; shell"), shell.variations());
        assertEquals(List.of("deployment=atlas; compass"), compass.variations());

        AnalysisEntry entry = result.analysis().get(0);
        assertEquals(2, entry.appearanceCount());
        assertEquals(List.of("deployment=atlas; compass", "deployment=atlas; shell"), entry.labels());
        assertEquals(2, result.extraction().size());
        assertEquals(List.of("deployment=atlas; shell"), result.extraction().get(0).selections());
    }

    @Test
    void parse_sameTabSetUnderTwoSelections_mergesIntoOneTabSet() {
        String tabs = """
                  .. tabs::

                     .. tab::
                        :tabid: shell

                        1. Open a shell.
                        2. Run connect.
            """;
        String text = """
            Connect
            =======

            .. composable-tutorial::
               :options: deployment
               :defaults: atlas

               .. selected-content::
                  :selections: atlas

            %s
               .. selected-content::
                  :selections: local

            %s""".formatted(tabs, tabs);

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.tabSets().size());
        assertEquals(0, result.tabSets().get(0).handle());
        assertEquals(1, result.procedures().size());
        Procedure procedure = result.procedures().get(0);
        assertSame(result.tabSets().get(0), procedure.tabSet());
        assertEquals(List.of("deployment=atlas; shell", "deployment=local; shell"), procedure.variations());
        assertEquals(2, result.analysis().get(0).appearanceCount());
    }

    @Test
    void parse_stepLevelTabs_becomeVariationsOfOneProcedure() {
        String text = """
            Connect
            =======

            .. procedure::

               .. step:: Connect

                  .. tabs::

                     .. tab::
                        :tabid: shell

                        Run mongosh.

                     .. tab::
                        :tabid: compass

                        Open Compass.
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.procedures().size());
        Procedure procedure = result.procedures().get(0);
        assertNull(procedure.tabSet());
        assertEquals(List.of("compass", "shell"), procedure.variations());
        List<Variation> variations = procedure.steps().get(0).variations();
        assertEquals("Open Compass.", variations.get(0).content());
        assertEquals(2, result.analysis().get(0).appearanceCount());
    }

    @Test
    void parse_conditionalBlocksInsideOneStep_reportOneProcedureWithBothSelections() {
        String text = """
            Connect
            =======

            .. composable-tutorial::
               :options: driver
               :defaults: nodejs

               .. procedure::

                  .. step:: Connect to the cluster

                     .. selected-content::
                        :selections: nodejs

                        Call MongoClient.connect.

                     .. selected-content::
                        :selections: python

                        Create a MongoClient.
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.analysis().size());
        assertEquals(List.of("driver=nodejs", "driver=python"), result.analysis().get(0).labels());
        assertEquals(1, result.extraction().size());
        assertEquals(List.of("driver=nodejs", "driver=python"), result.extraction().get(0).selections());
        assertTrue(result.isClean());
    }

    @Test
    void parse_wrapperSelections_groupIdenticalContentAcrossSelections() {
        String text = """
            Install
            =======

            .. composable-tutorial::
               :options: language
               :defaults: python

               .. selected-content::
                  :selections: python

                  .. procedure::

                     .. step:: Install the package

                        Run the installer.

               .. selected-content::
                  :selections: java

                  .. procedure::

                     .. step:: Install the package

                        Run the installer.

               .. selected-content::
                  :selections: csharp

                  .. procedure::

                     .. step:: Install the package

                        Run dotnet add.
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(2, result.procedures().size());
        assertEquals(List.of("language=java", "language=python"), result.procedures().get(0).variations());
        assertEquals(List.of("language=csharp"), result.procedures().get(1).variations());
        assertEquals(List.of("language"), result.procedures().get(0).composable().options());

        assertEquals(1, result.analysis().size());
        AnalysisEntry entry = result.analysis().get(0);
        assertEquals(3, entry.appearanceCount());
        assertEquals(List.of("language=csharp", "language=java", "language=python"), entry.labels());

        List<ExtractionUnit> extraction = result.extraction();
        assertEquals(2, extraction.size());
        assertEquals(List.of("language=java", "language=python"), extraction.get(0).selections());
        assertEquals(List.of("language=csharp"), extraction.get(1).selections());
    }

    @Test
    void parse_includeInsideWrapperBringingSelections_isScannedForVariations() {
        documents.put("includes/install-choices.rst", """
            .. selected-content::
               :selections: python

               Run pip install.

            .. selected-content::
               :selections: java

               Add the Maven dependency.
            """);
        String text = """
            .. composable-tutorial::
               :options: language
               :defaults: python

               .. procedure::

                  .. step:: Install

                     .. include:: /includes/install-choices.rst
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.procedures().size());
        Step step = result.procedures().get(0).steps().get(0);
        assertEquals("", step.content());
        assertEquals(List.of("language=java", "language=python"),
            step.variations().stream().map(Variation::label).toList());
        assertEquals("Run pip install.", step.variations().get(1).content());
        assertEquals(2, result.analysis().get(0).appearanceCount());
        assertTrue(result.isClean());
    }

    @Test
    void parse_numberedHeadingsUnderProcedureHeading_becomeSteps() {
        String text = """
            Deploy
            ======

            Procedure
            ---------

            1. Prepare the host
            ~~~~~~~~~~~~~~~~~~~~~~

            Install the packages.

            2. Start the service
            ~~~~~~~~~~~~~~~~~~~~~~

            Run the start command.

            Next steps
            ----------

            Read more.
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.procedures().size());
        Procedure procedure = result.procedures().get(0);
        assertEquals(ProcedureFormat.NUMBERED_HEADINGS, procedure.format());
        assertEquals("Deploy", procedure.heading());
        assertEquals(List.of("Prepare the host", "Start the service"), titles(procedure));
        assertEquals("Install the packages.", procedure.steps().get(0).content());
        assertEquals("Run the start command.", procedure.steps().get(1).content());
    }

    @Test
    void parse_procedureNestedInStep_staysNested() {
        String text = """
            .. procedure::

               .. step:: Configure

                  Edit the config.

                  .. procedure::

                     .. step:: Open the file

                     .. step:: Save the file
            """;

        ProcedureParseResult result = parser.parse("index.rst", text);

        assertEquals(1, result.procedures().size());
        Procedure procedure = result.procedures().get(0);
        Step outer = procedure.steps().get(0);
        assertEquals("Edit the config.", outer.content());
        assertEquals(List.of("Open the file", "Save the file"),
            outer.nestedSteps().stream().map(Step::title).toList());
        assertEquals(2, procedure.maxNestingDepth());
        assertTrue(result.analysis().get(0).hasSubSteps());
    }

    @Test
    void parse_listsInsideStep_becomeSubProcedures() {
        String text = """
            .. procedure::

               .. step:: Prepare

                  a. Check disk space.
                  #. Check memory.
            """;

        Step step = parser.parse("index.rst", text).procedures().get(0).steps().get(0);

        assertEquals("", step.content());
        assertEquals(1, step.subProcedures().size());
        assertEquals(MarkerType.ALPHABETIC, step.subProcedures().get(0).markerType());
        assertEquals(2, step.subProcedures().get(0).items().size());
        assertEquals("b", step.subProcedures().get(0).items().get(1).label());
    }

    @Test
    void parse_emptyProcedureContainer_producesNothing() {
        ProcedureParseResult result = parser.parse("index.rst", ".. procedure::\n");

        assertTrue(result.procedures().isEmpty());
        assertTrue(result.analysis().isEmpty());
        assertTrue(result.extraction().isEmpty());
        assertTrue(result.isClean());
    }

    @Test
    void parse_yamlStepsInclude_producesYamlProcedure() {
        documents.put("includes/steps-install.yaml", """
            title: Download
            pre: Fetch the archive.
            ---
            title: Unpack
            pre: Extract it.
            """);

        ProcedureParseResult result = parser.parse("index.rst",
            "Install\n=======\n\n.. include:: /includes/steps/install.rst\n");

        Procedure procedure = result.procedures().get(0);
        assertEquals(ProcedureFormat.YAML_STEPS, procedure.format());
        assertEquals("Install", procedure.heading());
        assertEquals(List.of("Download", "Unpack"), titles(procedure));
        assertEquals("Fetch the archive.", procedure.steps().get(0).content());
    }

    @Test
    void parse_missingInclude_reportsWarningAndContinues() {
        ProcedureParseResult result = parser.parse("index.rst", ".. include:: missing.rst\n\n" + LIST_INSTALL);

        assertEquals(1, result.procedures().size());
        assertFalse(result.isClean());
        assertEquals(WarningType.INCLUDE_NOT_FOUND, result.warnings().get(0).type());
    }

    @Test
    void parse_selfInclude_reportsCycle() {
        ProcedureParseResult result = parser.parse("index.rst", ".. include:: index.rst\n");

        assertEquals(1, result.warnings().size());
        assertEquals(WarningType.INCLUDE_CYCLE, result.warnings().get(0).type());
    }

    @Test
    void parse_unreadableInclude_throws() throws IOException {
        DocumentSource failing = mock(DocumentSource.class);
        when(failing.read(anyString())).thenThrow(new IOException("permission denied"));
        ProcedureParser failingParser =
            new ProcedureParser(failing, new SourceRootPathResolver(), ProcedureParserSettings.defaults());

        assertThrows(ProcedureParsingException.class,
            () -> failingParser.parse("index.rst", ".. include:: other.rst\n"));
    }

    private static List<String> titles(Procedure procedure) {
        return procedure.steps().stream().map(Step::title).toList();
    }
}
