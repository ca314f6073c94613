package io.ragent.app;

import io.ragent.cli.AskCommand;
import io.ragent.cli.CliContext;
import io.ragent.cli.IngestCommand;
import io.ragent.cli.OnboardCommand;
import io.ragent.cli.RagentCliCommand;
import io.ragent.cli.StatusCommand;
import io.ragent.core.agent.RagAgent;
import io.ragent.core.config.ConfigPaths;
import io.ragent.core.config.ConfigService;
import io.ragent.core.config.model.AgentDefaults;
import io.ragent.core.config.model.ProviderConfig;
import io.ragent.core.config.model.ProvidersConfig;
import io.ragent.core.config.model.RagentConfig;
import io.ragent.core.config.model.RetrievalConfig;
import io.ragent.core.gateway.ProviderGateway;
import io.ragent.core.provider.DisabledProvider;
import io.ragent.core.provider.LlmProvider;
import io.ragent.core.provider.OpenAiCompatProvider;
import io.ragent.core.provider.ProviderRegistry;
import io.ragent.core.provider.ProviderRouter;
import io.ragent.core.retrieval.InMemoryVectorStore;
import io.ragent.core.retrieval.IngestionPipeline;
import io.ragent.core.retrieval.OpenAiEmbeddingClient;
import io.ragent.core.retrieval.RecursiveTextSplitter;
import io.ragent.core.retrieval.WebDocumentLoader;
import io.ragent.core.tool.ToolRegistry;
import io.ragent.core.tool.impl.RetrieverTool;
import java.io.IOException;
import java.util.List;
import picocli.CommandLine;

public final class RagentApplication {

    private RagentApplication() {
    }

    public static void main(String[] args) {
        ConfigService configService = new ConfigService();

        CliContext context = new CliContext(
            RagentApplication::buildAgent,
            configService,
            ConfigPaths.defaultConfigPath(),
            config -> ingest(config, newStore(config.retrieval(), config.providers()))
        );

        CommandLine commandLine = new CommandLine(new RagentCliCommand());
        commandLine.addSubcommand("onboard", new OnboardCommand(context));
        commandLine.addSubcommand("ask", new AskCommand(context));
        commandLine.addSubcommand("ingest", new IngestCommand(context));
        commandLine.addSubcommand("status", new StatusCommand(context));

        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    static RagAgent buildAgent(RagentConfig config) throws IOException {
        AgentDefaults agent = config.agent();
        ProviderRegistry providerRegistry = new ProviderRegistry();
        for (String name : List.of("lmstudio", "openai", "openrouter")) {
            providerRegistry.register(buildOpenAiCompatProvider(name, config.providers().byName(name)));
        }
        LlmProvider provider = new ProviderRouter(providerRegistry).resolve(agent.provider(), agent.model());
        ProviderGateway gateway = new ProviderGateway(provider, agent.model(), agent.temperature(), agent.maxTokens());

        RetrievalConfig retrieval = config.retrieval();
        InMemoryVectorStore store = newStore(retrieval, config.providers());
        ingest(config, store);

        ToolRegistry toolRegistry = new ToolRegistry();
        toolRegistry.register(new RetrieverTool(retrieval.toolName(), retrieval.toolDescription(), store));
        return new RagAgent(gateway, toolRegistry, agent.toSettings());
    }

    static LlmProvider buildOpenAiCompatProvider(String name, ProviderConfig providerConfig) {
        if (providerConfig != null && providerConfig.configured()) {
            String apiBase = providerConfig.apiBaseOr(ProvidersConfig.defaultBase(name));
            return new OpenAiCompatProvider(name, providerConfig.apiKey(), apiBase, providerConfig.extraHeaders());
        }
        return new DisabledProvider(name, "missing API key");
    }

    private static InMemoryVectorStore newStore(RetrievalConfig retrieval, ProvidersConfig providers) {
        String embeddingProvider = retrieval.embeddingProvider();
        ProviderConfig providerConfig = providers.byName(embeddingProvider);
        OpenAiEmbeddingClient embeddings = new OpenAiEmbeddingClient(
            providerConfig.apiKey(),
            providerConfig.apiBaseOr(ProvidersConfig.defaultBase(embeddingProvider)),
            retrieval.embeddingModel()
        );
        return new InMemoryVectorStore(embeddings, retrieval.topK());
    }

    private static IngestionPipeline.Report ingest(RagentConfig config, InMemoryVectorStore store) throws IOException {
        RetrievalConfig retrieval = config.retrieval();
        IngestionPipeline pipeline = new IngestionPipeline(
            new WebDocumentLoader(),
            new RecursiveTextSplitter(retrieval.chunkSize(), retrieval.chunkOverlap())
        );
        return pipeline.ingest(retrieval.urls(), store);
    }
}
