package com.vgen.runner;

import com.vgen.archive.ArchiveLedger;
import com.vgen.archive.ArchiveRecord;
import com.vgen.archive.ArchiveTarget;
import com.vgen.config.PipelineConfig;
import com.vgen.dialogue.content.ContentCorpus;
import com.vgen.dialogue.content.ContentKey;
import com.vgen.dialogue.context.ContextTurn;
import com.vgen.dialogue.context.ContextWindowBuilder;
import com.vgen.dialogue.index.SequenceIndex;
import com.vgen.dialogue.model.DialogueNode;
import com.vgen.dialogue.path.PathResolver;
import com.vgen.dialogue.path.ResolvedPath;
import com.vgen.dialogue.state.StateSpec;
import com.vgen.generation.client.GenerationResult;
import com.vgen.generation.client.GeneratorClient;
import com.vgen.generation.prompt.ExemplarCollector;
import com.vgen.generation.prompt.GenerationPrompt;
import com.vgen.generation.prompt.PromptBuilder;
import com.vgen.generation.validation.ValidationResult;
import com.vgen.generation.validation.VariantValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Runs the full pipeline for one target: content key lookup, path resolution, context window, exemplars,
 * prompt, generation, validation, append (write mode only) and archive. An archive record is written for
 * every attempt, including failed ones; failures are then rethrown to the caller.
 */
public final class TargetProcessor {

    private static final Logger log = LoggerFactory.getLogger(TargetProcessor.class);

    private final PipelineConfig config;
    private final StateSpec state;
    private final SequenceIndex index;
    private final ContentCorpus corpus;
    private final PathResolver resolver;
    private final ContextWindowBuilder contextBuilder;
    private final ExemplarCollector exemplarCollector;
    private final PromptBuilder promptBuilder;
    private final GeneratorClient generator;
    private final VariantValidator validator;
    private final ArchiveLedger archive;
    private final Clock clock;
    private final boolean writeMode;

    public TargetProcessor(PipelineConfig config, StateSpec state, SequenceIndex index, ContentCorpus corpus,
                           GeneratorClient generator, ArchiveLedger archive, Clock clock, boolean writeMode) {
        this.config = config;
        this.state = state;
        this.index = index;
        this.corpus = corpus;
        this.resolver = new PathResolver(index);
        this.contextBuilder = new ContextWindowBuilder(index, corpus, config.getContext());
        this.exemplarCollector = new ExemplarCollector(corpus, config.getContext());
        this.promptBuilder = new PromptBuilder(config);
        this.generator = generator;
        this.validator = new VariantValidator(config);
        this.archive = archive;
        this.clock = clock;
        this.writeMode = writeMode;
    }

    public TargetOutcome process(TargetRef target) {
        ArchiveRecord.Builder record = ArchiveRecord.builder(OffsetDateTime.now(clock).toString(), writeMode)
                .target(new ArchiveTarget(target.sequenceId(), target.messageId(), null, null))
                .config(config.toSnapshot())
                .stateSpec(state.toSnapshot());
        try {
            DialogueNode node = index.require(target.toAddress());
            String rawKey = node.getContentKey();
            if (rawKey == null || rawKey.isBlank()) {
                throw new InvalidTargetException("Message " + target.messageId() + " has no contentKey. Add one first.");
            }
            ContentKey key = ContentKey.parse(rawKey);
            if (!key.isValid()) {
                throw new InvalidTargetException("Invalid contentKey format: " + rawKey);
            }
            Path targetFile = corpus.resolve(key);
            record.target(new ArchiveTarget(target.sequenceId(), target.messageId(), key.getKey(), targetFile.toString()));

            ResolvedPath path = resolver.resolve(state, target.toAddress());
            record.resolvedPath(path);
            if (path.fallback()) {
                log.warn("No route from the entry point to {}; using the target alone as context", target);
            }
            List<ContextTurn> context = contextBuilder.build(path);
            record.context(context);

            List<String> exemplars = exemplarCollector.collect(key);
            List<String> existing = corpus.readLines(key);
            record.exemplars(exemplars, existing);

            GenerationPrompt prompt = promptBuilder.build(key.getKey(), key.toFilePath(), node.getText(), context,
                    exemplars, existing);
            record.prompt(prompt);

            GenerationResult result = generator.generate(prompt);
            record.exchange(result.getRequestSent(), result.getRawResponse());

            ValidationResult validation = validator.validate(result.getVariants(), existing);
            List<String> accepted = validation.accepted();
            record.accepted(accepted, validation.rejected().size());
            log.info("{}: {} of {} candidates accepted for {}", target, accepted.size(),
                    result.getVariants().size(), key.getKey());

            if (writeMode) {
                corpus.append(key, accepted);
            } else {
                log.info("(dry-run) Would append to: {}", targetFile);
                for (String line : accepted) {
                    log.info("   + {}", line);
                }
            }
            Optional<Path> archived = archive.record(record.succeeded());
            return new TargetOutcome(target, key.getKey(), targetFile, accepted, writeMode, archived);
        } catch (RuntimeException e) {
            archive.record(record.failed(e));
            throw e;
        }
    }
}
