package io.chatgate.cli;

import io.chatgate.core.provider.ProviderRegistry;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

@Command(name = "models", description = "List providers and their model aliases")
public final class ModelsCommand implements Callable<Integer> {
    private final CliContext context;

    public ModelsCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        ProviderRegistry registry = context.gateway().registry();
        for (String provider : registry.listProviders()) {
            System.out.println(provider + " (" + registry.find(provider).orElseThrow().baseUrl() + ")");
            Map<String, String> catalog = registry.modelCatalog(provider);
            for (String alias : registry.listModelAliases(provider)) {
                String literal = catalog.getOrDefault(alias, alias);
                System.out.println(alias.equals(literal) ? "  " + alias : "  " + alias + " -> " + literal);
            }
        }
        return 0;
    }
}
