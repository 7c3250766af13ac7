package com.purchasingpower.codelod.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Command Arguments Tests")
class CommandArgumentsTest {

    @Test
    @DisplayName("First bare token is the command, the rest are positionals")
    void parse_commandAndPositionals() {
        CommandArguments args = CommandArguments.parse("invalidate", "sha256:aa", "sha256:bb");

        assertThat(args.command()).contains("invalidate");
        assertThat(args.positionals()).containsExactly("sha256:aa", "sha256:bb");
        assertThat(args.positional(1)).contains("sha256:bb");
        assertThat(args.positional(2)).isEmpty();
    }

    @Test
    @DisplayName("Options with and without values")
    void parse_options() {
        CommandArguments args = CommandArguments.parse("read", "src", "--format=json", "--scope=class",
            "--scope=function", "--stale-only");

        assertThat(args.option("format")).contains("json");
        assertThat(args.option("scope")).contains("function");
        assertThat(args.hasOption("stale-only")).isTrue();
        assertThat(args.option("stale-only")).isEmpty();
        assertThat(args.optionNames()).containsExactlyInAnyOrder("format", "scope", "stale-only");
    }

    @Test
    @DisplayName("Grouped short flags are split")
    void parse_shortFlags() {
        CommandArguments args = CommandArguments.parse("update", "-yq");

        assertThat(args.hasFlag('y')).isTrue();
        assertThat(args.hasFlag('q')).isTrue();
        assertThat(args.positionals()).isEmpty();
    }

    @Test
    @DisplayName("No tokens means no command")
    void parse_empty() {
        CommandArguments args = CommandArguments.parse();

        assertThat(args.command()).isEmpty();
        assertThat(args.optionNames()).isEmpty();
    }
}
