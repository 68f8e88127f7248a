package io.chatgate.cli;

import picocli.CommandLine.Command;

@Command(name = "chatgate", mixinStandardHelpOptions = true, description = "Multi-provider chat gateway")
public final class ChatgateCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
