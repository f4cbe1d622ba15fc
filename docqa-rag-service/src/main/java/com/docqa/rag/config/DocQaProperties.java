package com.docqa.rag.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "docqa")
public class DocQaProperties {

    private ChunkingConfig chunking = new ChunkingConfig();
    private RetrievalConfig retrieval = new RetrievalConfig();
    private SummarizationConfig summarization = new SummarizationConfig();
    private GatewayConfig gateway = new GatewayConfig();
    private BatchConfig batch = new BatchConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private LearningPathConfig learningPath = new LearningPathConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private PersistenceConfig persistence = new PersistenceConfig();

    @Data
    public static class ChunkingConfig {
        private int maxChars = 2000;
        private int overlapChars = 200;
        private int boundaryLookbackChars = 100;
    }

    @Data
    public static class RetrievalConfig {
        private int topK = 4;
        private int maxContextChars = 6000;
        private double minRelevanceScore = 0.1;
    }

    @Data
    public static class SummarizationConfig {
        private int singlePassChars = 6000;
        private int chunkChars = 4000;
        private int chunkOverlapChars = 200;
        private int maxReduceRounds = 3;
        private int mapParallelism = 4;
    }

    @Data
    public static class GatewayConfig {
        private Duration perCallTimeout = Duration.ofSeconds(60);
        private Duration hardCeiling = Duration.ofSeconds(180);
        private double temperature = 0.2;
        private int maxTokens = 1024;
        private long healthCheckIntervalMs = 60000;
        private int poolSize = 8;
    }

    @Data
    public static class BatchConfig {
        private int parallelism = 4;
        private boolean failFast = false;
    }

    @Data
    public static class EmbeddingConfig {
        /** Name of the embedding provider entry used for chunks and questions. */
        private String provider = "local-hash";
        private int batchSize = 16;
        private int maxConcurrent = 4;
    }

    @Data
    public static class IngestionConfig {
        private int parallelism = 2;
    }

    @Data
    public static class LearningPathConfig {
        private int maxTokens = 2048;
        private int defaultDurationWeeks = 4;
        private int maxDurationWeeks = 52;
        private int maxGoals = 5;
    }

    @Data
    public static class ProviderConfig {
        private String name;
        private String kind = "generation";
        private String type;
        private String baseUrl;
        private String model;
        private String apiKey;
        private int priority = 100;
        /** Vector size, local-hash only. */
        private int dimension = 384;
        private boolean enabled = true;
    }

    @Data
    public static class PersistenceConfig {
        private boolean enabled = false;
        private String exportPath = "data/documents.json";
    }
}
