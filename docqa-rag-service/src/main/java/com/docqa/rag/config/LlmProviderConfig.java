package com.docqa.rag.config;

import com.docqa.rag.chunk.TextChunker;
import com.docqa.rag.config.DocQaProperties.ProviderConfig;
import com.docqa.rag.embedding.EmbeddingProvider;
import com.docqa.rag.embedding.EmbeddingService;
import com.docqa.rag.embedding.HashingEmbeddingProvider;
import com.docqa.rag.embedding.OllamaEmbeddingsClient;
import com.docqa.rag.embedding.OpenAIEmbeddingsClient;
import com.docqa.rag.extract.DocumentTextExtractor;
import com.docqa.rag.index.VectorIndex;
import com.docqa.rag.learning.LearningPathOrchestrator;
import com.docqa.rag.llm.GenerationProvider;
import com.docqa.rag.llm.LlmGateway;
import com.docqa.rag.llm.OllamaChatClient;
import com.docqa.rag.llm.OpenAIChatClient;
import com.docqa.rag.llm.ProviderKind;
import com.docqa.rag.llm.ProviderRegistry;
import com.docqa.rag.llm.ProviderType;
import com.docqa.rag.metrics.RagMetrics;
import com.docqa.rag.persist.DocumentSetExporter;
import com.docqa.rag.persist.DocumentSetPersistence;
import com.docqa.rag.qa.QaOrchestrator;
import com.docqa.rag.service.DocQaService;
import com.docqa.rag.service.IngestionService;
import com.docqa.rag.store.ChunkStore;
import com.docqa.rag.store.DocumentStore;
import com.docqa.rag.summarize.SummarizationOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Builds the provider registry from {@code docqa.providers} and wires the
 * pipeline components around it.
 */
@Configuration
@Slf4j
public class LlmProviderConfig {

    static final String DEFAULT_EMBEDDING_PROVIDER = "local-hash";
    private static final int DEFAULT_HASH_DIMENSION = 384;

    @Bean
    public ProviderRegistry providerRegistry(DocQaProperties props) {
        ProviderRegistry registry = new ProviderRegistry();
        for (ProviderConfig p : props.getProviders()) {
            if (!p.isEnabled()) {
                log.info("Provider {} is disabled, skipping", p.getName());
                continue;
            }
            ProviderKind kind = ProviderKind.valueOf(p.getKind().trim().toUpperCase(Locale.ROOT));
            ProviderType type = ProviderType.fromConfig(p.getType());
            if (kind == ProviderKind.GENERATION) {
                registry.registerGeneration(generationProvider(p, type, props), type, p.getPriority());
            } else {
                registry.registerEmbedding(embeddingProvider(p, type), type, p.getModel(), p.getPriority());
            }
            log.info("Registered {} provider {} ({}, model={}, priority={})",
                    kind, p.getName(), type, p.getModel(), p.getPriority());
        }
        if (registry.embedding(DEFAULT_EMBEDDING_PROVIDER).isEmpty()) {
            registry.registerEmbedding(new HashingEmbeddingProvider(DEFAULT_EMBEDDING_PROVIDER, DEFAULT_HASH_DIMENSION),
                    ProviderType.LOCAL_HASH, "hash-" + DEFAULT_HASH_DIMENSION, Integer.MAX_VALUE);
        }
        return registry;
    }

    @Bean
    public EmbeddingService embeddingService(ProviderRegistry registry,
                                             DocQaProperties props,
                                             @Qualifier("embeddingExecutor") ThreadPoolTaskExecutor executor) {
        String name = props.getEmbedding().getProvider();
        EmbeddingProvider provider = registry.embedding(name)
                .orElseThrow(() -> new IllegalStateException("docqa.embedding.provider '" + name
                        + "' does not match any enabled embedding provider"));
        log.info("Embedding with provider {} ({})", provider.getName(), provider.getConfigurationId());
        return new EmbeddingService(provider, executor.getThreadPoolExecutor(),
                props.getEmbedding().getBatchSize(), props.getEmbedding().getMaxConcurrent());
    }

    @Bean
    public LlmGateway llmGateway(ProviderRegistry registry,
                                 DocQaProperties props,
                                 @Qualifier("gatewayExecutor") ThreadPoolTaskExecutor executor,
                                 RagMetrics metrics) {
        DocQaProperties.GatewayConfig g = props.getGateway();
        return new LlmGateway(registry, executor.getThreadPoolExecutor(), g.getPerCallTimeout(), g.getHardCeiling(),
                g.getTemperature(), g.getMaxTokens(), metrics);
    }

    @Bean
    public VectorIndex vectorIndex() {
        return new VectorIndex();
    }

    @Bean
    public ChunkStore chunkStore() {
        return new ChunkStore();
    }

    @Bean
    public DocumentStore documentStore(ChunkStore chunkStore, VectorIndex vectorIndex) {
        return new DocumentStore(chunkStore, vectorIndex);
    }

    @Bean
    public TextChunker textChunker(DocQaProperties props) {
        DocQaProperties.ChunkingConfig c = props.getChunking();
        return new TextChunker(c.getMaxChars(), c.getOverlapChars(), c.getBoundaryLookbackChars());
    }

    @Bean
    public DocumentTextExtractor documentTextExtractor() {
        return new DocumentTextExtractor();
    }

    @Bean
    public IngestionService ingestionService(DocumentStore documentStore,
                                             DocumentTextExtractor extractor,
                                             TextChunker chunker,
                                             EmbeddingService embeddingService,
                                             @Qualifier("ingestionExecutor") ThreadPoolTaskExecutor executor,
                                             RagMetrics metrics) {
        return new IngestionService(documentStore, extractor, chunker, embeddingService, executor, metrics);
    }

    @Bean
    public QaOrchestrator qaOrchestrator(DocumentStore documentStore,
                                         EmbeddingService embeddingService,
                                         LlmGateway gateway,
                                         DocQaProperties props,
                                         RagMetrics metrics) {
        DocQaProperties.RetrievalConfig r = props.getRetrieval();
        return new QaOrchestrator(documentStore, embeddingService, gateway,
                r.getMaxContextChars(), r.getMinRelevanceScore(), metrics);
    }

    @Bean
    public SummarizationOrchestrator summarizationOrchestrator(LlmGateway gateway,
                                                               DocQaProperties props,
                                                               @Qualifier("summaryMapExecutor") ThreadPoolTaskExecutor executor,
                                                               RagMetrics metrics) {
        DocQaProperties.SummarizationConfig s = props.getSummarization();
        return new SummarizationOrchestrator(gateway, executor.getThreadPoolExecutor(), s.getSinglePassChars(),
                s.getChunkChars(), s.getChunkOverlapChars(), s.getMaxReduceRounds(), metrics);
    }

    @Bean
    public LearningPathOrchestrator learningPathOrchestrator(LlmGateway gateway, DocQaProperties props,
                                                             RagMetrics metrics) {
        DocQaProperties.LearningPathConfig l = props.getLearningPath();
        return new LearningPathOrchestrator(gateway, l.getMaxTokens(), l.getMaxDurationWeeks(), l.getMaxGoals(),
                metrics);
    }

    @Bean
    public DocumentSetExporter documentSetExporter(DocumentStore documentStore) {
        return new DocumentSetExporter(documentStore);
    }

    @Bean
    @ConditionalOnProperty(name = "docqa.persistence.enabled", havingValue = "true")
    public DocumentSetPersistence documentSetPersistence(DocumentSetExporter exporter, DocQaProperties props) {
        return new DocumentSetPersistence(exporter, Path.of(props.getPersistence().getExportPath()));
    }

    @Bean
    public DocQaService docQaService(DocumentStore documentStore,
                                     IngestionService ingestionService,
                                     QaOrchestrator qaOrchestrator,
                                     SummarizationOrchestrator summarizer,
                                     ProviderRegistry registry,
                                     DocumentSetExporter exporter,
                                     @Qualifier("batchExecutor") ThreadPoolTaskExecutor executor,
                                     DocQaProperties props) {
        return new DocQaService(documentStore, ingestionService, qaOrchestrator, summarizer, registry, exporter,
                executor.getThreadPoolExecutor(), props.getRetrieval().getTopK(), props.getBatch().isFailFast());
    }

    private static GenerationProvider generationProvider(ProviderConfig p, ProviderType type, DocQaProperties props) {
        return switch (type) {
            case OLLAMA -> new OllamaChatClient(p.getName(), p.getBaseUrl(), p.getModel(),
                    props.getGateway().getPerCallTimeout());
            case OPENAI -> new OpenAIChatClient(p.getName(), p.getBaseUrl(), p.getModel(), p.getApiKey(),
                    props.getGateway().getPerCallTimeout());
            case LOCAL_HASH -> throw new IllegalStateException(
                    "Provider " + p.getName() + ": local-hash can only be an embedding provider");
        };
    }

    private static EmbeddingProvider embeddingProvider(ProviderConfig p, ProviderType type) {
        return switch (type) {
            case OLLAMA -> new OllamaEmbeddingsClient(p.getName(), p.getBaseUrl(), p.getModel());
            case OPENAI -> new OpenAIEmbeddingsClient(p.getName(), p.getBaseUrl(), p.getModel(), p.getApiKey());
            case LOCAL_HASH -> new HashingEmbeddingProvider(p.getName(), p.getDimension());
        };
    }
}
