package com.example.automation.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * 实时通道的JSON编解码器
 *
 * <p>服务端和观察者客户端共用，保证双方对帧形状的理解一致：
 * <ul>
 *   <li>出站：四种 {@link StatusEvent}，每帧一个事件</li>
 *   <li>入站：{@code subscribe} 控制帧</li>
 * </ul>
 * 任何无法识别的帧都以 {@link MalformedFrameException} 报告，由调用方决定丢弃。
 * </p>
 */
@Component
public class MessageCodec {

    public static final String SUBSCRIBE_TYPE = "subscribe";

    private static final int PREVIEW_LENGTH = 120;

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 序列化状态事件（带 {@code type} 标签）
     */
    public String encode(StatusEvent event) {
        try {
            return objectMapper.writerFor(StatusEvent.class).writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + event.type().tag() + " event", e);
        }
    }

    /**
     * 解析状态事件帧
     *
     * @param frame JSON文本帧
     * @return 解析后的事件
     * @throws MalformedFrameException 如果帧不是合法JSON，或标签缺失/未知
     */
    public StatusEvent decodeEvent(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new MalformedFrameException("Empty frame");
        }
        try {
            StatusEvent event = objectMapper.readValue(frame, StatusEvent.class);
            if (event == null) {
                throw new MalformedFrameException("Frame has no content: " + preview(frame));
            }
            return event;
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Unrecognized status frame: " + preview(frame), e);
        }
    }

    public String encodeSubscribe(String sessionId) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("type", SUBSCRIBE_TYPE);
        node.put("sessionId", sessionId);
        return node.toString();
    }

    /**
     * 解析客户端控制帧，目前只接受 {@code subscribe}
     *
     * @throws MalformedFrameException 如果标签不是 {@code subscribe} 或缺少sessionId
     */
    public SubscribeFrame decodeControl(String frame) {
        JsonNode node;
        try {
            node = objectMapper.readTree(frame == null ? "" : frame);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException("Control frame is not valid JSON: " + preview(frame), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedFrameException("Control frame must be a JSON object: " + preview(frame));
        }

        JsonNode type = node.path("type");
        if (!type.isTextual() || !SUBSCRIBE_TYPE.equals(type.asText())) {
            throw new MalformedFrameException("Unknown control frame type: " + type);
        }

        JsonNode sessionId = node.path("sessionId");
        if (!sessionId.isTextual() || sessionId.asText().isBlank()) {
            throw new MalformedFrameException("Subscribe frame without sessionId");
        }
        return new SubscribeFrame(sessionId.asText());
    }

    private static String preview(String frame) {
        if (frame == null) {
            return "null";
        }
        return frame.length() <= PREVIEW_LENGTH ? frame : frame.substring(0, PREVIEW_LENGTH) + "...";
    }
}
