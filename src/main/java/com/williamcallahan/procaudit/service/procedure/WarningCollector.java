package com.williamcallahan.procaudit.service.procedure;

import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning;
import com.williamcallahan.procaudit.domain.procedure.ProcessingWarning.WarningType;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates warnings for a single parse pass. Not shared between passes.
 */
final class WarningCollector {

    private final List<ProcessingWarning> warnings = new ArrayList<>();

    void add(WarningType type, String message, int line, String documentPath) {
        warnings.add(new ProcessingWarning(message, type, Math.max(0, line), documentPath));
    }

    List<ProcessingWarning> snapshot() {
        return List.copyOf(warnings);
    }
}
