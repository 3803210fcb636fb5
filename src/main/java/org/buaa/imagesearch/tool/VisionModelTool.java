package org.buaa.imagesearch.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.buaa.imagesearch.common.consts.SystemConstants;
import org.buaa.imagesearch.common.convention.exception.PermanentRemoteException;
import org.buaa.imagesearch.config.IngestionProperties;
import org.buaa.imagesearch.config.VisionModelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 视觉与向量模型客户端
 * 负责图片描述、文本向量编码与图片相似原因生成，每个方法即一次远程调用，不做重试
 */
@Component
public class VisionModelTool {

    private static final Logger log = LoggerFactory.getLogger(VisionModelTool.class);

    private final WebClient httpClient;
    private final VisionModelProperties modelProperties;
    private final IngestionProperties.Timeouts timeouts;
    private final ObjectMapper jsonParser;

    public VisionModelTool(WebClient visionWebClient,
                           VisionModelProperties modelProperties,
                           IngestionProperties ingestionProperties,
                           ObjectMapper objectMapper) {
        this.httpClient = visionWebClient;
        this.modelProperties = modelProperties;
        this.timeouts = ingestionProperties.getTimeouts();
        this.jsonParser = objectMapper;
    }

    /**
     * 生成图片的文字描述
     *
     * @param image JPEG 图片
     * @return 描述文本
     */
    public Mono<String> describe(byte[] image) {
        List<Map<String, Object>> content = new ArrayList<>();
        content.add(textPart(SystemConstants.DESCRIBE_PROMPT));
        content.add(imagePart(image));
        return invokeChatApi(content, modelProperties.getDescribe(), timeouts.getDescribe());
    }

    /**
     * 生成两张图片相似原因的一句话说明
     */
    public Mono<String> compare(byte[] queryImage, byte[] similarImage) {
        List<Map<String, Object>> content = new ArrayList<>();
        content.add(textPart(SystemConstants.COMPARE_PROMPT));
        content.add(imagePart(queryImage));
        content.add(imagePart(similarImage));
        return invokeChatApi(content, modelProperties.getCompare(), timeouts.getExplain());
    }

    /**
     * 文本向量编码
     *
     * @param text 输入文本
     * @return 向量数组
     */
    public Mono<float[]> embed(String text) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", modelProperties.getEmbeddingModel());
        body.put("input", text);
        body.put("encoding_format", "float");

        return httpClient.post()
            .uri("/embeddings")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeouts.getEmbed())
            .map(this::extractVectorFromResponse);
    }

    /**
     * 调用对话接口
     */
    private Mono<String> invokeChatApi(List<Map<String, Object>> content,
                                       VisionModelProperties.GenerationParams params,
                                       Duration timeout) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", modelProperties.getChatModel());
        payload.put("messages", List.of(Map.of("role", "user", "content", content)));
        payload.put("stream", false);
        if (params.getMaxTokens() != null) {
            payload.put("max_tokens", params.getMaxTokens());
        }
        if (params.getTemperature() != null) {
            payload.put("temperature", params.getTemperature());
        }

        return httpClient.post()
            .uri("/chat/completions")
            .contentType(MediaType.APPLICATION_JSON)
            .accept(MediaType.APPLICATION_JSON)
            .bodyValue(payload)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .map(this::extractMessageContent);
    }

    private Map<String, Object> textPart(String text) {
        return Map.of("type", "text", "text", text);
    }

    private Map<String, Object> imagePart(byte[] image) {
        String dataUrl = "data:" + SystemConstants.PROCESSED_CONTENT_TYPE + ";base64,"
            + Base64.getEncoder().encodeToString(image);
        return Map.of("type", "image_url", "image_url", Map.of("url", dataUrl));
    }

    private String extractMessageContent(String response) {
        try {
            JsonNode rootNode = jsonParser.readTree(response);
            JsonNode contentNode = rootNode.path("choices").path(0).path("message").path("content");
            if (contentNode.isMissingNode() || contentNode.isNull()) {
                throw new PermanentRemoteException("模型响应缺少 choices[0].message.content", null);
            }
            return contentNode.asText("").trim();
        } catch (PermanentRemoteException e) {
            throw e;
        } catch (Exception e) {
            throw new PermanentRemoteException("模型响应解析失败: " + e.getMessage(), e);
        }
    }

    private float[] extractVectorFromResponse(String response) {
        try {
            JsonNode embeddingNode = jsonParser.readTree(response).path("data").path(0).path("embedding");
            if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
                throw new PermanentRemoteException("API响应格式异常: 缺少 data[0].embedding", null);
            }
            float[] vector = new float[embeddingNode.size()];
            for (int i = 0; i < embeddingNode.size(); i++) {
                vector[i] = (float) embeddingNode.get(i).asDouble();
            }
            log.debug("向量编码完成，维度: {}", vector.length);
            return vector;
        } catch (PermanentRemoteException e) {
            throw e;
        } catch (Exception e) {
            throw new PermanentRemoteException("向量响应解析失败: " + e.getMessage(), e);
        }
    }
}
