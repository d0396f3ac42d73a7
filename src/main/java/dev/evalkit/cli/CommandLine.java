package dev.evalkit.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Parsed arguments: positionals, {@code --name value} options and boolean flags. */
final class CommandLine {
    static final Set<String> FLAGS = Set.of("verbose", "latest", "fail-on-regression", "help");
    static final Set<String> OPTIONS =
            Set.of(
                    "dataset",
                    "version",
                    "model",
                    "models",
                    "format",
                    "config",
                    "run",
                    "name",
                    "description");

    private final List<String> positionals;
    private final Map<String, String> options;
    private final Set<String> flags;

    private CommandLine(List<String> positionals, Map<String, String> options, Set<String> flags) {
        this.positionals = positionals;
        this.options = options;
        this.flags = flags;
    }

    static CommandLine parse(String... args) {
        var positionals = new ArrayList<String>();
        var options = new HashMap<String, String>();
        var flags = new HashSet<String>();
        for (int i = 0; i < args.length; i++) {
            var arg = args[i];
            if (!arg.startsWith("--")) {
                positionals.add(arg);
                continue;
            }
            var name = arg.substring(2);
            String inlineValue = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inlineValue = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            if (FLAGS.contains(name) && inlineValue == null) {
                flags.add(name);
            } else if (OPTIONS.contains(name)) {
                if (inlineValue != null) {
                    options.put(name, inlineValue);
                } else if (i + 1 < args.length) {
                    options.put(name, args[++i]);
                } else {
                    throw new UsageException("option --%s needs a value".formatted(name));
                }
            } else {
                throw new UsageException("unknown option --" + name);
            }
        }
        return new CommandLine(positionals, options, flags);
    }

    Optional<String> positional(int index) {
        return index < positionals.size() ? Optional.of(positionals.get(index)) : Optional.empty();
    }

    String requirePositional(int index, String what) {
        return positional(index).orElseThrow(() -> new UsageException("missing " + what));
    }

    Optional<String> option(String name) {
        return Optional.ofNullable(options.get(name));
    }

    String requireOption(String name) {
        return option(name).orElseThrow(() -> new UsageException("missing --" + name));
    }

    boolean flag(String name) {
        return flags.contains(name);
    }

    static final class UsageException extends RuntimeException {
        UsageException(String message) {
            super(message);
        }
    }
}
