package com.eyelevel.documentanalysis.service.llm;

import com.eyelevel.documentanalysis.config.DocumentAnalysisConfig;
import com.eyelevel.documentanalysis.exception.ModelInvocationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Invokes the Anthropic model hosted on Bedrock through the messages API.
 * <p>
 * Every call is a single user message. The client does not retry; failures surface as
 * {@link ModelInvocationException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BedrockModelClient {

    private static final String JSON = "application/json";

    private final BedrockRuntimeClient bedrockRuntimeClient;
    private final ObjectMapper objectMapper;
    private final DocumentAnalysisConfig analysisConfig;

    /**
     * Sends a text-only prompt.
     *
     * @return The text of the first content block of the reply.
     */
    public String complete(final String prompt, final int maxTokens, final double temperature) {
        return invoke(List.of(textBlock(prompt)), maxTokens, temperature);
    }

    /**
     * Sends an instruction together with a whole document. Images are sent as {@code image} blocks,
     * everything else as {@code document} blocks.
     */
    public String completeWithDocument(final String instruction, final byte[] document, final String mediaType,
                                       final int maxTokens, final double temperature) {
        final Map<String, Object> source = new LinkedHashMap<>();
        source.put("type", "base64");
        source.put("media_type", mediaType);
        source.put("data", Base64.getEncoder().encodeToString(document));

        final Map<String, Object> documentBlock = new LinkedHashMap<>();
        documentBlock.put("type", mediaType.startsWith("image/") ? "image" : "document");
        documentBlock.put("source", source);

        return invoke(List.of(textBlock(instruction), documentBlock), maxTokens, temperature);
    }

    private String invoke(final List<Map<String, Object>> content, final int maxTokens, final double temperature) {
        final DocumentAnalysisConfig.Bedrock bedrock = analysisConfig.getBedrock();
        final String body = toRequestBody(content, maxTokens, temperature);

        final long start = System.currentTimeMillis();
        final InvokeModelResponse response;
        try {
            response = bedrockRuntimeClient.invokeModel(
                    InvokeModelRequest.builder().modelId(bedrock.getModelId()).contentType(JSON).accept(JSON)
                                      .body(SdkBytes.fromUtf8String(body)).build());
        } catch (SdkException e) {
            throw new ModelInvocationException("Model invocation failed: " + e.getMessage(), e);
        }
        log.info("Model {} responded in {} ms.", bedrock.getModelId(), System.currentTimeMillis() - start);

        return readText(response.body().asUtf8String());
    }

    String toRequestBody(final List<Map<String, Object>> content, final int maxTokens, final double temperature) {
        final Map<String, Object> request = new LinkedHashMap<>();
        request.put("anthropic_version", analysisConfig.getBedrock().getAnthropicVersion());
        request.put("max_tokens", maxTokens);
        request.put("messages", List.of(Map.of("role", "user", "content", content)));
        request.put("temperature", temperature);
        request.put("top_p", analysisConfig.getBedrock().getTopP());
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ModelInvocationException("Could not serialize the model request.", e);
        }
    }

    String readText(final String responseBody) {
        final JsonNode root;
        try {
            root = objectMapper.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new ModelInvocationException("Model returned a malformed response.", e);
        }
        final String text = root.path("content").path(0).path("text").asText("");
        if (text.isEmpty()) {
            throw new ModelInvocationException("Model returned no text.");
        }
        return text;
    }

    private static Map<String, Object> textBlock(final String text) {
        final Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "text");
        block.put("text", text);
        return block;
    }
}
