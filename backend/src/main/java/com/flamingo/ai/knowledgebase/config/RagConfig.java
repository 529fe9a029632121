package com.flamingo.ai.knowledgebase.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the ingestion pipeline and hybrid retrieval. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Sparse sparse = new Sparse();
  private Search search = new Search();
  private Rerank rerank = new Rerank();
  private Parsing parsing = new Parsing();
  private Image image = new Image();
  private Storage storage = new Storage();
  private Summary summary = new Summary();

  /** Boundary heuristics of the layout-aware chunker. Lower bounds are enforced by the chunker. */
  @Getter
  @Setter
  public static class Chunking {
    /** Hard ceiling on parent size; a parent is flushed before it would exceed it. */
    private int maxParentTokens = 2000;

    /** Minimum parent size before a page break or type shift may start a new parent. */
    private int splitMinParentTokens = 600;

    /** Minimum number of children before a soft split is allowed. */
    private int splitMinChildren = 3;

    /** Longest single line that may be treated as a pseudo heading. */
    private int pseudoTitleMaxChars = 64;

    /** Text children above this size are split recursively. */
    private int maxChildTokens = 512;

    private boolean pseudoTitleEnabled = true;
    private boolean pageBreakSplitEnabled = true;
    private boolean typeShiftSplitEnabled = true;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Content above this budget is truncated before embedding. */
    private int maxEmbeddingTokens = 2048;

    /** Maximum number of concurrent dense embedding calls per document. */
    private int concurrency = 4;
  }

  @Getter
  @Setter
  public static class Sparse {
    /** Remote sparse encoder base URL; local TF-IDF is used when blank. */
    private String encoderUrl = "";

    private int maxTerms = 256;
    private Duration timeout = Duration.ofSeconds(30);
  }

  @Getter
  @Setter
  public static class Search {
    private int exactTopK = 10;

    /** Rows fetched per LIKE lookup before exact hits are ranked and cut to exactTopK. */
    private int exactCandidateLimit = 200;
    private int sparseTopK = 60;
    private int denseTopK = 60;
    private int rrfK = 60;

    /** Number of fused candidates passed to the reranker. */
    private int fusedTopK = 20;

    /** Upper bound for a requested topK. */
    private int maxTopK = 50;

    /** Budget shared by all recall paths of one request. */
    private Duration timeout = Duration.ofSeconds(15);
  }

  /** Cross-encoder reranker settings (Jina-compatible API). */
  @Getter
  @Setter
  public static class Rerank {
    private boolean enabled = true;
    private String url = "https://api.jina.ai/v1/rerank";
    private String apiKey = "";
    private String model = "jina-reranker-v3";

    /** Minimum relevance score when the reranker produced the score. */
    private double threshold = 0.2;

    /** Minimum cosine similarity when the embedding fallback produced the score. */
    private double fallbackThreshold = 0.85;

    private Duration timeout = Duration.ofSeconds(20);
  }

  @Getter
  @Setter
  public static class Parsing {
    private MineruCloud mineruCloud = new MineruCloud();
    private MineruLocal mineruLocal = new MineruLocal();
    private Audio audio = new Audio();

    /** Token-based MinerU service; skipped when no token is set. */
    @Getter
    @Setter
    public static class MineruCloud {
      private String token = "";
      private String baseUrl = "https://mineru.net";
      private String modelVersion = "vlm";
      private Duration pollInterval = Duration.ofSeconds(5);
      private Duration timeout = Duration.ofSeconds(600);
    }

    /** Self-hosted MinerU API. */
    @Getter
    @Setter
    public static class MineruLocal {
      private boolean enabled = true;
      private String baseUrl = "http://localhost:9999";
      private Duration timeout = Duration.ofSeconds(300);
    }

    /** OpenAI-compatible speech-to-text for audio uploads. */
    @Getter
    @Setter
    public static class Audio {
      private boolean enabled = false;
      private String model = "whisper-1";
      private Duration timeout = Duration.ofSeconds(300);
    }
  }

  @Getter
  @Setter
  public static class Image {
    /** Whether uploaded images are described by the vision model. */
    private boolean captionEnabled = false;

    /** Lifetime of the presigned URL embedded in image chunks. */
    private Duration urlExpiry = Duration.ofDays(7);
  }

  /** S3-compatible blob store. */
  @Getter
  @Setter
  public static class Storage {
    private String endpoint = "";
    private String region = "us-east-1";
    private String bucket = "knowledge-base";
    private String accessKey = "";
    private String secretKey = "";
    private boolean pathStyleAccess = true;

    /** Lifetime of presigned URLs handed to external parsers. */
    private Duration presignExpiry = Duration.ofHours(1);
  }

  @Getter
  @Setter
  public static class Summary {
    /** Document text is truncated to this many characters before summarization. */
    private int maxInputChars = 6000;
  }
}
