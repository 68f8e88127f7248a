package io.chatgate.cli;

import io.chatgate.core.model.ContentPart;
import io.chatgate.core.model.GenerationOptions;
import io.chatgate.core.model.GenerationResult;
import io.chatgate.core.model.MessageRole;
import io.chatgate.core.model.StreamEvent;
import io.chatgate.core.model.Turn;
import io.chatgate.core.stream.GenerationStream;
import java.io.PrintStream;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send a single prompt to a provider")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Prompt to send")
    String prompt;

    @Option(names = {"-p", "--provider"}, description = "Provider key", defaultValue = "openai")
    String provider;

    @Option(names = {"-m", "--model"}, description = "Model alias or id", defaultValue = "gpt-4o-mini")
    String model;

    @Option(names = {"-s", "--system"}, description = "System prompt")
    String system;

    @Option(names = "--stream", description = "Print the reply as it arrives")
    boolean stream;

    @Option(names = "--temperature", description = "Sampling temperature (0-2)", defaultValue = "0.7")
    double temperature;

    @Option(names = "--max-tokens", description = "Maximum tokens to generate (1-4000)", defaultValue = "1000")
    int maxTokens;

    @Option(names = "--image", description = "Image file to attach (repeatable)")
    List<Path> images = new ArrayList<>();

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            GenerationOptions options = new GenerationOptions(temperature, maxTokens);
            List<Turn> turns = buildTurns();
            if (stream) {
                return streamReply(turns, options);
            }
            GenerationResult result = context.gateway().generate(provider, model, turns, options);
            System.out.println(result.content());
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }

    private int streamReply(List<Turn> turns, GenerationOptions options) {
        PrintStream out = System.out;
        try (GenerationStream events = context.gateway().generateStreaming(provider, model, turns, options)) {
            while (events.hasNext()) {
                StreamEvent event = events.next();
                if (event instanceof StreamEvent.Chunk chunk) {
                    out.print(chunk.text());
                    out.flush();
                } else if (event instanceof StreamEvent.Completed) {
                    out.println();
                } else if (event instanceof StreamEvent.Failed failed) {
                    out.println();
                    System.err.println("Chat command failed: " + failed.message());
                    return 1;
                }
            }
        }
        return 0;
    }

    private List<Turn> buildTurns() throws Exception {
        List<Turn> turns = new ArrayList<>();
        if (system != null && !system.isBlank()) {
            turns.add(Turn.system(system));
        }
        if (images.isEmpty()) {
            turns.add(Turn.user(prompt));
            return turns;
        }
        List<ContentPart> parts = new ArrayList<>();
        parts.add(ContentPart.text(prompt));
        for (Path image : images) {
            parts.add(ContentPart.Image.fromBytes(mimeType(image), Files.readAllBytes(image)));
        }
        turns.add(Turn.of(MessageRole.USER, parts));
        return turns;
    }

    private static String mimeType(Path image) {
        String guessed = URLConnection.guessContentTypeFromName(image.getFileName().toString());
        if (guessed != null && !guessed.isBlank()) {
            return guessed;
        }
        String name = image.getFileName().toString().toLowerCase();
        return name.endsWith(".webp") ? "image/webp" : "application/octet-stream";
    }
}
