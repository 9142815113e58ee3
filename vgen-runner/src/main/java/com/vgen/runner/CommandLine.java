package com.vgen.runner;

import java.util.Optional;

/**
 * Parsed command-line options.
 * <pre>
 *   --sequence &lt;id&gt; --message &lt;n&gt;   single target
 *   --list &lt;file&gt;                     targets, one seq:msg per line
 *   --config &lt;file&gt;                   pipeline configuration
 *   --state &lt;file&gt;                    hypothetical user state for path resolution
 *   --write                           append accepted lines (otherwise dry run)
 *   --verbose                         debug logging
 *   -h, --help
 * </pre>
 */
public final class CommandLine {

    static final String USAGE = """
            Dialogue variant generator

            Usage:
              vgen --sequence <id> --message <id> [--config <file>] [--state <file>] [--write]
              vgen --list targets.txt [--config <file>] [--state <file>] [--write]

            Options:
              --sequence <id>   Sequence ID (e.g., onboarding_seq)
              --message <id>    Message ID integer within the sequence
              --list <file>     File with lines: <sequenceId>:<messageId>
              --config <file>   Path to the config file (default: $VGEN_CONFIG or tool/variants_config.yaml)
              --state <file>    State spec: entry point, branch mode, variables, choices, limits
              --write           Actually append to content files (otherwise dry-run)
              --verbose         Debug logging and stack traces for failed targets
              --help, -h        Show this help
            """;

    private final String sequenceId;
    private final Integer messageId;
    private final String listPath;
    private final String configPath;
    private final String statePath;
    private final boolean write;
    private final boolean verbose;
    private final boolean help;

    private CommandLine(String sequenceId, Integer messageId, String listPath, String configPath,
                        String statePath, boolean write, boolean verbose, boolean help) {
        this.sequenceId = sequenceId;
        this.messageId = messageId;
        this.listPath = listPath;
        this.configPath = configPath;
        this.statePath = statePath;
        this.write = write;
        this.verbose = verbose;
        this.help = help;
    }

    /**
     * @throws UsageException on unknown options, missing option values or a non-integer message id
     */
    public static CommandLine parse(String[] args) {
        String sequenceId = null;
        Integer messageId = null;
        String listPath = null;
        String configPath = null;
        String statePath = null;
        boolean write = false;
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "--sequence" -> sequenceId = next(args, ++i, a);
                case "--message" -> {
                    String raw = next(args, ++i, a);
                    try {
                        messageId = Integer.parseInt(raw.trim());
                    } catch (NumberFormatException e) {
                        throw new UsageException("Invalid --message value: " + raw);
                    }
                }
                case "--list" -> listPath = next(args, ++i, a);
                case "--config" -> configPath = next(args, ++i, a);
                case "--state" -> statePath = next(args, ++i, a);
                case "--write" -> write = true;
                case "--verbose" -> verbose = true;
                case "-h", "--help" -> help = true;
                default -> throw new UsageException("Unknown arg: " + a);
            }
        }
        return new CommandLine(sequenceId, messageId, listPath, configPath, statePath, write, verbose, help);
    }

    private static String next(String[] args, int i, String flag) {
        if (i >= args.length) {
            throw new UsageException("Missing value after " + flag);
        }
        return args[i];
    }

    public Optional<TargetRef> singleTarget() {
        return sequenceId != null && messageId != null
                ? Optional.of(new TargetRef(sequenceId, messageId))
                : Optional.empty();
    }

    public Optional<String> getListPath() {
        return Optional.ofNullable(listPath);
    }

    public Optional<String> getConfigPath() {
        return Optional.ofNullable(configPath);
    }

    public Optional<String> getStatePath() {
        return Optional.ofNullable(statePath);
    }

    public boolean isWrite() {
        return write;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isHelp() {
        return help;
    }
}
