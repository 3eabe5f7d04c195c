package io.marketlens.service.analysis;

import io.marketlens.domain.analysis.ContextBundle;
import io.marketlens.domain.analysis.ReasoningOutput;
import io.marketlens.domain.common.Deadline;

/**
 * Turns a context bundle into a structured assessment.
 */
public interface ReasoningBackend {

    /** Short label reported on the insight, e.g. "local" or "cloud". */
    String name();

    ReasoningOutput infer(ContextBundle bundle, Deadline deadline) throws Exception;
}
