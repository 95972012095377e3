package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;
import com.williamcallahan.procaudit.service.source.DocumentSource;
import com.williamcallahan.procaudit.service.source.PathResolver;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Replaces inclusion references with the blocks of the documents they name.
 *
 * <p>Included blocks are spliced into the container that held the reference, so conditional
 * block boundaries are never merged or reordered. Inside a composable wrapper that declares no
 * conditional blocks of its own, a reference inside a step is expanded first and inspected: when
 * the included text brings conditional blocks they are spliced in, otherwise the reference becomes
 * one prose block carrying the included text.</p>
 *
 * <p>Missing targets, cycles and chains deeper than the limit are reported as resolution warnings
 * and leave the reference as prose. Any other read failure aborts the parse.</p>
 */
final class IncludeExpander {

    private static final String STEPS_DIRECTORY = "steps/";

    private final BlockScanner scanner;
    private final StepsYamlConverter stepsConverter;
    private final DocumentSource documentSource;
    private final PathResolver pathResolver;
    private final int maxDepth;

    IncludeExpander(BlockScanner scanner, DocumentSource documentSource, PathResolver pathResolver, int maxDepth) {
        this.scanner = Objects.requireNonNull(scanner, "Scanner cannot be null");
        this.documentSource = Objects.requireNonNull(documentSource, "Document source cannot be null");
        this.pathResolver = Objects.requireNonNull(pathResolver, "Path resolver cannot be null");
        if (maxDepth < 1) {
            throw new IllegalArgumentException("Include depth limit must be positive");
        }
        this.maxDepth = maxDepth;
        this.stepsConverter = new StepsYamlConverter(scanner);
    }

    /**
     * Expanded block tree of one document and the policy used to expand it.
     */
    record ExpandedDocument(List<Block> blocks, IncludePolicy policy) {
        ExpandedDocument {
            blocks = List.copyOf(blocks);
        }
    }

    /**
     * Expands every reference reachable from the document's blocks.
     *
     * @param documentPath path of the root document, the first entry of every inclusion chain
     * @param blocks scanned blocks of the root document
     * @param warnings collector for this parse
     * @return expanded blocks and the chosen policy
     * @throws ProcedureParsingException when an included document cannot be read for a reason
     *         other than not existing
     */
    ExpandedDocument expand(String documentPath, List<Block> blocks, WarningCollector warnings) {
        IncludePolicy policy = choosePolicy(blocks);
        Deque<String> chain = new ArrayDeque<>();
        chain.push(documentPath);
        Expansion expansion = new Expansion(policy, warnings);
        List<Block> expanded = expansion.expandAll(blocks, documentPath, chain, false);
        return new ExpandedDocument(expanded, policy);
    }

    static IncludePolicy choosePolicy(List<Block> blocks) {
        if (containsKind(blocks, BlockKind.CONDITIONAL)) {
            return IncludePolicy.CONDITIONAL_SCOPED;
        }
        if (!containsKind(blocks, BlockKind.COMPOSABLE)) {
            return IncludePolicy.EXPAND_ALL;
        }
        return IncludePolicy.SPECULATIVE;
    }

    static boolean containsKind(List<Block> blocks, BlockKind kind) {
        for (Block block : blocks) {
            if (block.is(kind) || containsKind(block.children(), kind)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Candidate paths for a resolved target. A {@code steps/name.rst} reference is first tried as
     * the {@code steps-name.yaml} file the documentation build generates it from.
     */
    static List<String> candidatePaths(String resolved) {
        List<String> candidates = new ArrayList<>(2);
        int stepsIndex = resolved.indexOf(STEPS_DIRECTORY);
        if (stepsIndex >= 0 && (stepsIndex == 0 || resolved.charAt(stepsIndex - 1) == '/')) {
            String name = resolved.substring(stepsIndex + STEPS_DIRECTORY.length());
            int extension = name.lastIndexOf('.');
            if (extension > 0) {
                name = name.substring(0, extension);
            }
            candidates.add(resolved.substring(0, stepsIndex) + "steps-" + name + ".yaml");
        }
        candidates.add(resolved);
        return candidates;
    }

    /**
     * State of one expansion pass.
     */
    private final class Expansion {
        private final IncludePolicy policy;
        private final WarningCollector warnings;

        Expansion(IncludePolicy policy, WarningCollector warnings) {
            this.policy = policy;
            this.warnings = warnings;
        }

        List<Block> expandAll(List<Block> blocks, String documentPath, Deque<String> chain, boolean insideStep) {
            List<Block> expanded = new ArrayList<>(blocks.size());
            for (Block block : blocks) {
                switch (block.kind()) {
                    case INCLUDE -> expanded.addAll(expandReference(block, documentPath, chain, insideStep));
                    case COMPOSABLE, PROCEDURE, LIST_ITEM, CONDITIONAL, TAB_GROUP, TAB ->
                        expanded.add(block.withChildren(expandAll(block.children(), documentPath, chain, insideStep)));
                    case STEP -> expanded.add(block.withChildren(expandAll(block.children(), documentPath, chain, true)));
                    case HEADING, PROSE -> expanded.add(block);
                }
            }
            return expanded;
        }

        private List<Block> expandReference(Block reference, String documentPath, Deque<String> chain,
                                            boolean insideStep) {
            LoadedDocument loaded = load(reference, documentPath, chain);
            if (loaded == null) {
                return List.of(asProse(reference));
            }
            chain.push(loaded.path());
            List<Block> included;
            try {
                included = expandAll(loaded.blocks(), loaded.path(), chain, insideStep);
            } finally {
                chain.pop();
            }
            if (policy != IncludePolicy.SPECULATIVE || !insideStep || containsKind(included, BlockKind.CONDITIONAL)) {
                return included;
            }
            return List.of(Block.prose(reference.line(), BlockRenderer.render(included)));
        }

        private LoadedDocument load(Block reference, String documentPath, Deque<String> chain) {
            String target = reference.argument();
            if (chain.size() > maxDepth) {
                warnings.add(WarningType.INCLUDE_DEPTH_EXCEEDED,
                    String.format(Locale.ROOT, "Include of '%s' exceeds the depth limit of %d", target, maxDepth),
                    reference.line(), documentPath);
                return null;
            }
            String resolved = pathResolver.resolve(documentPath, target);
            for (String candidate : candidatePaths(resolved)) {
                if (chain.contains(candidate)) {
                    warnings.add(WarningType.INCLUDE_CYCLE,
                        String.format(Locale.ROOT, "Include of '%s' refers back to '%s'", target, candidate),
                        reference.line(), documentPath);
                    return null;
                }
                String text;
                try {
                    text = documentSource.read(candidate);
                } catch (NoSuchFileException missing) {
                    continue;
                } catch (IOException readFailure) {
                    throw new ProcedureParsingException(
                        String.format(Locale.ROOT, "Failed to read included document '%s' from '%s'", candidate, documentPath),
                        readFailure);
                }
                if (StepsYamlConverter.isStepsFile(candidate)) {
                    return new LoadedDocument(candidate,
                        List.of(stepsConverter.convert(candidate, text, reference.line(), warnings)));
                }
                return new LoadedDocument(candidate, scanner.scan(candidate, text, warnings));
            }
            warnings.add(WarningType.INCLUDE_NOT_FOUND,
                String.format(Locale.ROOT, "Included document '%s' not found", target),
                reference.line(), documentPath);
            return null;
        }

        private Block asProse(Block reference) {
            return Block.prose(reference.line(), BlockRenderer.render(reference));
        }
    }

    private record LoadedDocument(String path, List<Block> blocks) {}
}
