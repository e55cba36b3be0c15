package io.netorca.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@TopCommand
@Command(name = "netorca", mixinStandardHelpOptions = true, version = "0.1.0",
    description = "Query and update NetOrca change instances from automation pipelines",
    subcommands = {
        GetChangesCommand.class,
        GetServiceItemsCommand.class,
        UpdateChangeCommand.class,
        CompleteChangesCommand.class
    })
public class NetOrcaCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
