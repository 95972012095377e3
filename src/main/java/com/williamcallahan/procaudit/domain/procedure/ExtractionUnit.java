package com.williamcallahan.procaudit.domain.procedure;

import java.util.List;
import java.util.Objects;

/**
 * One distinct content body the extraction tool should write out.
 *
 * @param heading procedure heading
 * @param hash identity hash
 * @param shortHash hash fragment for disambiguating output names
 * @param steps steps to render
 * @param selections sorted selection or tab labels the body applies to
 */
public record ExtractionUnit(
    String heading,
    String hash,
    String shortHash,
    List<Step> steps,
    List<String> selections
) {

    public ExtractionUnit {
        Objects.requireNonNull(heading, "Heading cannot be null");
        Objects.requireNonNull(hash, "Hash cannot be null");
        Objects.requireNonNull(shortHash, "Short hash cannot be null");
        steps = steps == null ? List.of() : List.copyOf(steps);
        selections = selections == null ? List.of() : List.copyOf(selections);
    }
}
