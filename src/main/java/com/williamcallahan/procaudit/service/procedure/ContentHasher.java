package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.Step;
import com.williamcallahan.procaudit.domain.procedure.SubProcedure;
import com.williamcallahan.procaudit.domain.procedure.SubProcedureItem;
import com.williamcallahan.procaudit.domain.procedure.Variation;
import com.williamcallahan.procaudit.support.TextNormalizer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;

/**
 * Computes the identity hash of an assembled procedure.
 *
 * <p>The digest covers a tagged, length-prefixed serialization of the steps (titles, normalized
 * bodies, variations, sub-procedures and nested steps) and the sorted procedure-level labels.
 * The heading is outside the digest: identical content under two headings hashes the same.</p>
 */
final class ContentHasher {

    private static final char FIELD_SEPARATOR = '|';

    /**
     * Generates SHA-256 hash for any text content.
     *
     * @param text The text to hash
     * @return Hexadecimal string representation of the hash
     */
    String sha256(String text) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) sb.append(String.format("%02x", b));
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    /**
     * Hashes a procedure's steps together with its variation labels.
     *
     * @param steps assembled steps
     * @param labels procedure-level labels; sorted here before hashing
     * @return 64-character hex digest
     */
    String procedureHash(List<Step> steps, List<String> labels) {
        StringBuilder canonical = new StringBuilder();
        field(canonical, "procedure", Integer.toString(steps.size()));
        for (Step step : steps) {
            appendStep(canonical, step);
        }
        List<String> sortedLabels = CanonicalOrder.labels(labels);
        field(canonical, "labels", Integer.toString(sortedLabels.size()));
        for (String label : sortedLabels) {
            field(canonical, "label", label);
        }
        return sha256(canonical.toString());
    }

    private void appendStep(StringBuilder canonical, Step step) {
        field(canonical, "title", step.title().trim());
        field(canonical, "body", TextNormalizer.collapseWhitespace(step.content()));
        List<Variation> variations = CanonicalOrder.variations(step.variations());
        field(canonical, "variations", Integer.toString(variations.size()));
        for (Variation variation : variations) {
            field(canonical, "label", variation.label());
            field(canonical, "content", TextNormalizer.collapseWhitespace(variation.content()));
        }
        field(canonical, "subprocedures", Integer.toString(step.subProcedures().size()));
        for (SubProcedure subProcedure : step.subProcedures()) {
            field(canonical, "sub", subProcedureHash(subProcedure));
        }
        field(canonical, "nested", Integer.toString(step.nestedSteps().size()));
        for (Step nested : step.nestedSteps()) {
            appendStep(canonical, nested);
        }
    }

    private String subProcedureHash(SubProcedure subProcedure) {
        StringBuilder canonical = new StringBuilder();
        field(canonical, "marker", subProcedure.markerType().name());
        for (SubProcedureItem item : subProcedure.items()) {
            field(canonical, "item", TextNormalizer.collapseWhitespace(item.text()));
            field(canonical, "content", TextNormalizer.collapseWhitespace(item.content()));
            for (SubProcedure nested : item.subProcedures()) {
                field(canonical, "sub", subProcedureHash(nested));
            }
        }
        return sha256(canonical.toString());
    }

    private static void field(StringBuilder canonical, String tag, String value) {
        canonical.append(tag).append(FIELD_SEPARATOR)
            .append(value.length()).append(FIELD_SEPARATOR)
            .append(value).append(FIELD_SEPARATOR);
    }
}
