package com.eyelevel.documentanalysis.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds application properties under the "app.analysis" prefix to a strongly-typed
 * configuration object. This provides centralized control over extraction and analysis behavior.
 */
@Data
@ConfigurationProperties(prefix = "app.analysis")
public class DocumentAnalysisConfig {

    /**
     * Maximum number of characters of extracted text that is persisted and sent to the model.
     */
    private int inputCap = 30_000;

    /**
     * Maximum number of characters of the analysis result that is persisted.
     */
    private int outputCap = 10_000;

    private Extraction extraction = new Extraction();
    private Analysis analysis = new Analysis();
    private Bedrock bedrock = new Bedrock();
    private Polling polling = new Polling();
    private History history = new History();

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Extraction {
        /**
         * Budget of one fast-path OCR attempt.
         */
        private long ocrTimeoutMs = 3_000;
        /**
         * OCR output with fewer non-blank characters than this is treated as unsupported content.
         */
        private int minTextLength = 50;
        private String extractedTextPrefix = "extracted/";
        private Fallback fallback = new Fallback();

        @Data
        public static class Fallback {
            private RetryConfig retry = new RetryConfig();
            private int maxTokens = 8_000;
            private String instruction = "Extrae TODO el texto de este documento. Incluye texto de imágenes escaneadas. "
                    + "Devuelve SOLO el texto extraído sin comentarios adicionales.";
        }
    }

    @Data
    public static class Analysis {
        /**
         * How long a trigger waits for the model before handing the call off to the asynchronous path.
         */
        private long syncBudgetSeconds = 25;
        private int maxTokens = 10_000;
        private double temperature = 0.1;
    }

    @Data
    public static class Bedrock {
        private String modelId = "anthropic.claude-3-5-sonnet-20240620-v1:0";
        private String anthropicVersion = "bedrock-2023-05-31";
        private double topP = 0.9;
        private long readTimeoutSeconds = 120;
    }

    @Data
    public static class Polling {
        private long intervalSeconds = 3;
        private long maxWaitSeconds = 60;
    }

    @Data
    public static class History {
        private int defaultLimit = 50;
        private int maxLimit = 200;
    }
}
