package com.defiguard.policy;

import com.defiguard.tool.ToolName;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a tool may be called, from the current {@link PolicyDocument}.
 *
 * <p>Evaluation is a pure function of the document and the tool name: an exact rule
 * wins verbatim, otherwise the document's mode decides. Names outside the closed tool
 * set are denied regardless of mode.
 *
 * <p>The document sits in an {@link AtomicReference}; readers never lock and a reload
 * either installs a fully validated document or leaves the old one in place.
 */
public class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final PolicyDocumentLoader loader;
    private final AtomicReference<PolicyDocument> document;

    public PolicyEngine(PolicyDocumentLoader loader) {
        this.loader = loader;
        this.document = new AtomicReference<>(loader.load());
    }

    public PolicyEngine(PolicyDocument initial) {
        this.loader = null;
        this.document = new AtomicReference<>(initial);
    }

    public PolicyEvaluation evaluate(String toolName) {
        if (!ToolName.isWellFormed(toolName)) {
            return PolicyEvaluation.rejected("invalid tool name");
        }
        return ToolName.fromWireName(toolName)
                .map(this::evaluate)
                .orElseGet(() -> PolicyEvaluation.rejected("unknown tool"));
    }

    public PolicyEvaluation evaluate(ToolName toolName) {
        PolicyDocument current = document.get();
        return current.findRule(toolName)
                .map(PolicyEvaluation::fromRule)
                .orElseGet(() -> PolicyEvaluation.fromMode(current.getMode()));
    }

    public PolicyDocument getDocument() {
        return document.get();
    }

    /**
     * Re-reads the configured location and swaps the result in.
     *
     * @throws com.defiguard.exception.ConfigurationException if the new document is invalid;
     *         the current document stays active
     */
    public PolicyDocument reload() {
        if (loader == null) {
            throw new IllegalStateException("Policy engine was built without a loader");
        }
        return replace(loader.load());
    }

    public PolicyDocument replace(PolicyDocument next) {
        PolicyDocument previous = document.getAndSet(next);
        log.info(
                "Policy replaced [mode={} -> {}, rules={} -> {}]",
                previous.getMode().getWireValue(),
                next.getMode().getWireValue(),
                previous.getRulesByTool().size(),
                next.getRulesByTool().size());
        return next;
    }
}
