package com.vgen.archive;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import com.vgen.dialogue.context.ContextTurn;
import com.vgen.dialogue.path.ResolvedPath;
import com.vgen.generation.prompt.GenerationPrompt;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Audit trail of one generation attempt, serialized as JSON into the archive. Everything needed to
 * reproduce the attempt is captured: configuration and state snapshots, the resolved path, the prompt,
 * the request as sent, the raw response and the accepted lines. Stages that did not run are null and
 * omitted from the output.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"timestamp", "target", "writeMode", "status", "error", "config", "stateSpec",
        "resolvedPath", "context", "exemplars", "prompt", "requestSent", "response", "acceptedVariants",
        "rejectedCount"})
public final class ArchiveRecord {

    private final String timestamp;
    private final ArchiveTarget target;
    private final boolean writeMode;
    private final ArchiveStatus status;
    private final String error;
    private final Map<String, Object> config;
    private final Map<String, Object> stateSpec;
    private final ResolvedPath resolvedPath;
    private final List<ContextTurn> context;
    private final Map<String, List<String>> exemplars;
    private final GenerationPrompt prompt;
    private final JsonNode requestSent;
    private final JsonNode response;
    private final List<String> acceptedVariants;
    private final Integer rejectedCount;

    private ArchiveRecord(Builder b) {
        this.timestamp = Objects.requireNonNull(b.timestamp, "timestamp");
        this.target = Objects.requireNonNull(b.target, "target");
        this.writeMode = b.writeMode;
        this.status = Objects.requireNonNull(b.status, "status");
        this.error = b.error;
        this.config = b.config;
        this.stateSpec = b.stateSpec;
        this.resolvedPath = b.resolvedPath;
        this.context = b.context;
        if (b.siblingExemplars != null || b.existingVariants != null) {
            Map<String, List<String>> ex = new LinkedHashMap<>();
            ex.put("siblingSample", b.siblingExemplars != null ? b.siblingExemplars : List.of());
            ex.put("existingVariants", b.existingVariants != null ? b.existingVariants : List.of());
            this.exemplars = ex;
        } else {
            this.exemplars = null;
        }
        this.prompt = b.prompt;
        this.requestSent = b.requestSent;
        this.response = b.response;
        this.acceptedVariants = b.acceptedVariants;
        this.rejectedCount = b.rejectedCount;
    }

    public static Builder builder(String timestamp, boolean writeMode) {
        return new Builder(timestamp, writeMode);
    }

    public String getTimestamp() {
        return timestamp;
    }

    public ArchiveTarget getTarget() {
        return target;
    }

    public boolean isWriteMode() {
        return writeMode;
    }

    public ArchiveStatus getStatus() {
        return status;
    }

    public String getError() {
        return error;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    public Map<String, Object> getStateSpec() {
        return stateSpec;
    }

    public ResolvedPath getResolvedPath() {
        return resolvedPath;
    }

    public List<ContextTurn> getContext() {
        return context;
    }

    public Map<String, List<String>> getExemplars() {
        return exemplars;
    }

    public GenerationPrompt getPrompt() {
        return prompt;
    }

    public JsonNode getRequestSent() {
        return requestSent;
    }

    public JsonNode getResponse() {
        return response;
    }

    public List<String> getAcceptedVariants() {
        return acceptedVariants;
    }

    public Integer getRejectedCount() {
        return rejectedCount;
    }

    /** Collects stage outputs as a target is processed; unset stages stay null. */
    public static final class Builder {
        private final String timestamp;
        private final boolean writeMode;
        private ArchiveTarget target;
        private ArchiveStatus status;
        private String error;
        private Map<String, Object> config;
        private Map<String, Object> stateSpec;
        private ResolvedPath resolvedPath;
        private List<ContextTurn> context;
        private List<String> siblingExemplars;
        private List<String> existingVariants;
        private GenerationPrompt prompt;
        private JsonNode requestSent;
        private JsonNode response;
        private List<String> acceptedVariants;
        private Integer rejectedCount;

        private Builder(String timestamp, boolean writeMode) {
            this.timestamp = timestamp;
            this.writeMode = writeMode;
        }

        /** Replaced once the content key and file of the target are known. */
        public Builder target(ArchiveTarget target) {
            this.target = target;
            return this;
        }

        public Builder config(Map<String, Object> config) {
            this.config = config;
            return this;
        }

        public Builder stateSpec(Map<String, Object> stateSpec) {
            this.stateSpec = stateSpec;
            return this;
        }

        public Builder resolvedPath(ResolvedPath resolvedPath) {
            this.resolvedPath = resolvedPath;
            return this;
        }

        public Builder context(List<ContextTurn> context) {
            this.context = context;
            return this;
        }

        public Builder exemplars(List<String> siblingExemplars, List<String> existingVariants) {
            this.siblingExemplars = siblingExemplars;
            this.existingVariants = existingVariants;
            return this;
        }

        public Builder prompt(GenerationPrompt prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder exchange(JsonNode requestSent, JsonNode response) {
            this.requestSent = requestSent;
            this.response = response;
            return this;
        }

        public Builder accepted(List<String> acceptedVariants, int rejectedCount) {
            this.acceptedVariants = acceptedVariants;
            this.rejectedCount = rejectedCount;
            return this;
        }

        public ArchiveRecord succeeded() {
            this.status = writeMode ? ArchiveStatus.WRITTEN : ArchiveStatus.DRY_RUN;
            this.error = null;
            return new ArchiveRecord(this);
        }

        public ArchiveRecord failed(Throwable cause) {
            this.status = ArchiveStatus.FAILED;
            this.error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
            return new ArchiveRecord(this);
        }
    }
}
