package com.purchasingpower.codelod.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Arguments of one command invocation: the command name, positional values,
 * {@code --name[=value]} options and {@code -x} short flags.
 */
public class CommandArguments {

    private final String command;
    private final List<String> positionals;
    private final Map<String, List<String>> options;
    private final Set<Character> shortFlags;

    public CommandArguments(String command, List<String> positionals,
                            Map<String, List<String>> options, Set<Character> shortFlags) {
        this.command = command;
        this.positionals = List.copyOf(positionals);
        this.options = Map.copyOf(options);
        this.shortFlags = Set.copyOf(shortFlags);
    }

    public static CommandArguments from(ApplicationArguments args) {
        Map<String, List<String>> options = new LinkedHashMap<>();
        for (String name : args.getOptionNames()) {
            List<String> values = args.getOptionValues(name);
            options.put(name, values == null ? List.of() : List.copyOf(values));
        }
        return fromTokens(args.getNonOptionArgs(), options);
    }

    /**
     * Parses raw tokens the way Spring's command line parser does.
     */
    public static CommandArguments parse(String... tokens) {
        Map<String, List<String>> options = new LinkedHashMap<>();
        List<String> nonOptions = new ArrayList<>();
        for (String token : tokens) {
            if (token.startsWith("--") && token.length() > 2) {
                String body = token.substring(2);
                int eq = body.indexOf('=');
                String name = eq < 0 ? body : body.substring(0, eq);
                List<String> values = options.computeIfAbsent(name, k -> new ArrayList<>());
                if (eq >= 0) {
                    values.add(body.substring(eq + 1));
                }
            } else {
                nonOptions.add(token);
            }
        }
        return fromTokens(nonOptions, options);
    }

    private static CommandArguments fromTokens(List<String> nonOptions, Map<String, List<String>> options) {
        String command = null;
        List<String> positionals = new ArrayList<>();
        Set<Character> shortFlags = new HashSet<>();
        for (String token : nonOptions) {
            if (token.length() > 1 && token.startsWith("-") && !token.startsWith("--")) {
                for (char c : token.substring(1).toCharArray()) {
                    shortFlags.add(c);
                }
            } else if (command == null) {
                command = token;
            } else {
                positionals.add(token);
            }
        }
        return new CommandArguments(command, positionals, options, shortFlags);
    }

    public Optional<String> command() {
        return Optional.ofNullable(command);
    }

    public List<String> positionals() {
        return positionals;
    }

    public Optional<String> positional(int index) {
        return index < positionals.size() ? Optional.of(positionals.get(index)) : Optional.empty();
    }

    public boolean hasOption(String name) {
        return options.containsKey(name);
    }

    public boolean hasFlag(char flag) {
        return shortFlags.contains(flag);
    }

    /**
     * Last value given for the option; empty when absent or given without a value.
     */
    public Optional<String> option(String name) {
        List<String> values = options.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.get(values.size() - 1));
    }

    public Set<String> optionNames() {
        return options.keySet();
    }

    public Set<Character> shortFlags() {
        return shortFlags;
    }
}
