package com.amannmalik.finmoney.cli;

import picocli.CommandLine;
import picocli.CommandLine.*;
import picocli.CommandLine.Model.CommandSpec;

public final class Entrypoint {
    private Entrypoint() {
    }

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    public static CommandLine commandLine() {
        var commandLine = new CommandLine(new RootCommand());
        commandLine.addSubcommand("tick", new TickCommand());
        commandLine.addSubcommand("round", new RoundCommand());
        commandLine.addSubcommand("divide", new DivideCommand());
        commandLine.addSubcommand("percent-change", new PercentChangeCommand());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine;
    }

    @Command(
            name = "finmoney",
            description = "Exact-precision money arithmetic and tick quantization",
            mixinStandardHelpOptions = true,
            versionProvider = ManifestVersionProvider.class)
    static final class RootCommand implements Runnable {
        @Spec
        private CommandSpec spec;

        RootCommand() {
        }

        @Override
        public void run() {
            spec.commandLine().usage(spec.commandLine().getOut());
        }
    }

    public static final class ManifestVersionProvider implements IVersionProvider {
        public ManifestVersionProvider() {
        }

        @Override
        public String[] getVersion() {
            var version = Entrypoint.class.getPackage().getImplementationVersion();
            if (version == null || version.isBlank()) {
                version = "development";
            }
            return new String[]{"finmoney " + version};
        }
    }
}
