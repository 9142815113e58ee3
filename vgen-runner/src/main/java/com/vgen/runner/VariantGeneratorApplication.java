package com.vgen.runner;

import ch.qos.logback.classic.Level;
import com.vgen.archive.ArchiveLedger;
import com.vgen.archive.ArchiveStore;
import com.vgen.archive.FileArchiveStore;
import com.vgen.config.ConfigParseException;
import com.vgen.config.PipelineConfig;
import com.vgen.config.PipelineConfigLoader;
import com.vgen.dialogue.content.ContentCorpus;
import com.vgen.dialogue.index.FileSequenceSource;
import com.vgen.dialogue.index.SequenceIndex;
import com.vgen.dialogue.state.StateSpec;
import com.vgen.dialogue.state.StateSpecLoader;
import com.vgen.generation.client.GeneratorClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Command-line entry point. Environment: {@code VGEN_CONFIG} (config path when {@code --config} is not
 * given) and {@code VGEN_ASSETS_DIR} (root holding {@code sequences/} and {@code content/}, default
 * {@code assets}).
 * <p>
 * Exit status: 0 when every target succeeded, 1 when any target failed or configuration could not be
 * loaded, 2 on usage errors.
 */
public final class VariantGeneratorApplication {

    private static final Logger log = LoggerFactory.getLogger(VariantGeneratorApplication.class);

    static final String ENV_CONFIG = "VGEN_CONFIG";
    static final String ENV_ASSETS_DIR = "VGEN_ASSETS_DIR";
    static final String DEFAULT_ASSETS_DIR = "assets";

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private VariantGeneratorApplication() {
    }

    public static void main(String[] args) {
        System.exit(run(args, System::getenv, System.out));
    }

    static int run(String[] args, Function<String, String> env, PrintStream out) {
        CommandLine cli;
        try {
            cli = CommandLine.parse(args);
        } catch (UsageException e) {
            log.error("{}", e.getMessage());
            out.print(CommandLine.USAGE);
            return EXIT_USAGE;
        }
        if (cli.isHelp()) {
            out.print(CommandLine.USAGE);
            return EXIT_OK;
        }

        PipelineConfig config;
        StateSpec state;
        try {
            Path configPath = Path.of(cli.getConfigPath()
                    .orElse(Optional.ofNullable(env.apply(ENV_CONFIG)).filter(s -> !s.isBlank())
                            .orElse(PipelineConfigLoader.DEFAULT_CONFIG_PATH)));
            config = PipelineConfigLoader.load(configPath);
            state = cli.getStatePath().map(p -> StateSpecLoader.load(Path.of(p))).orElse(StateSpec.empty());
        } catch (ConfigParseException | UncheckedIOException e) {
            log.error("Failed to load configuration: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
        boolean verbose = cli.isVerbose() || config.getIo().isVerbose();
        if (verbose) {
            enableDebugLogging();
        }

        List<TargetRef> targets;
        try {
            if (cli.getListPath().isPresent()) {
                targets = TargetListReader.read(Path.of(cli.getListPath().get()));
            } else if (cli.singleTarget().isPresent()) {
                targets = List.of(cli.singleTarget().get());
            } else {
                log.error("Provide --sequence and --message, or --list <file>.");
                out.print(CommandLine.USAGE);
                return EXIT_USAGE;
            }
        } catch (InvalidTargetException | UncheckedIOException e) {
            log.error("{}", e.getMessage());
            return EXIT_USAGE;
        }

        Path assetsRoot = Path.of(Optional.ofNullable(env.apply(ENV_ASSETS_DIR)).filter(s -> !s.isBlank())
                .orElse(DEFAULT_ASSETS_DIR));
        TargetProcessor processor = createProcessor(config, state, assetsRoot, new GeneratorClient(config),
                Clock.systemDefaultZone(), cli.isWrite());
        BatchSummary summary = new BatchRunner(processor::process, config.getIo().isFailFast(), verbose).run(targets);
        out.println("Done. " + summary);
        return summary.exitCode();
    }

    static TargetProcessor createProcessor(PipelineConfig config, StateSpec state, Path assetsRoot,
                                           GeneratorClient generator, Clock clock, boolean writeMode) {
        SequenceIndex index = new SequenceIndex(new FileSequenceSource(assetsRoot));
        ContentCorpus corpus = new ContentCorpus(assetsRoot);
        Path archiveDir = Path.of(config.getIo().getArchiveDir());
        ArchiveStore store = new FileArchiveStore(archiveDir, clock);
        log.info("Assets: {} | archive: {} | mode: {}", assetsRoot.toAbsolutePath(), archiveDir,
                writeMode ? "write" : "dry-run");
        return new TargetProcessor(config, state, index, corpus, generator, new ArchiveLedger(store), clock, writeMode);
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger("com.vgen");
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
