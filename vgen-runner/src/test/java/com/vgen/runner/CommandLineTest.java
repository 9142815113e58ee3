package com.vgen.runner;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CommandLineTest {

    @Test
    void parse_singleTargetWithOptions() {
        CommandLine cli = CommandLine.parse(new String[]{
                "--sequence", "onboarding_seq", "--message", "4", "--config", "cfg.yaml", "--state", "s.yaml", "--write"});

        assertEquals(Optional.of(new TargetRef("onboarding_seq", 4)), cli.singleTarget());
        assertEquals(Optional.of("cfg.yaml"), cli.getConfigPath());
        assertEquals(Optional.of("s.yaml"), cli.getStatePath());
        assertTrue(cli.isWrite());
        assertFalse(cli.isVerbose());
        assertFalse(cli.isHelp());
    }

    @Test
    void parse_defaultsToDryRunWithoutTargets() {
        CommandLine cli = CommandLine.parse(new String[]{"--list", "targets.txt"});

        assertEquals(Optional.empty(), cli.singleTarget());
        assertEquals(Optional.of("targets.txt"), cli.getListPath());
        assertFalse(cli.isWrite());
    }

    @Test
    void parse_sequenceWithoutMessageIsNotATarget() {
        assertTrue(CommandLine.parse(new String[]{"--sequence", "s"}).singleTarget().isEmpty());
    }

    @Test
    void parse_usageErrors() {
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{"--message", "four"}));
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{"--sequence"}));
        assertThrows(UsageException.class, () -> CommandLine.parse(new String[]{"--bogus"}));
    }

    @Test
    void parse_help() {
        assertTrue(CommandLine.parse(new String[]{"-h"}).isHelp());
        assertTrue(CommandLine.parse(new String[]{"--help"}).isHelp());
    }
}
