package com.cardhub.engine.replication;

import com.cardhub.engine.core.EngineJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * 外壳与载荷的 JSON 编解码。
 * 编码失败属于程序错误（状态不可序列化），直接抛 IllegalStateException；
 * 解码失败属于对端消息损坏，抛 MalformedMessageException 交给调用方丢弃。
 */
public class SnapshotCodec {

    private static final TypeReference<Envelope<JsonNode>> RAW_ENVELOPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public SnapshotCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public SnapshotCodec() {
        this(EngineJson.MAPPER);
    }

    public String encode(Envelope<?> envelope) {
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("消息编码失败: " + envelope, e);
        }
    }

    /** 解出外壳，载荷保持为 JSON 树，等确认 kind/roomId 后再按类型读取 */
    public Envelope<JsonNode> decode(String json) {
        try {
            return mapper.readValue(json, RAW_ENVELOPE);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedMessageException("无法解析消息外壳", e);
        }
    }

    public JsonNode toTree(Object value) {
        return mapper.valueToTree(value);
    }

    public <A> A readAction(JsonNode payload, Class<A> actionType) {
        return read(payload, mapper.constructType(actionType), "动作");
    }

    public <S> TableSnapshot<S> readSnapshot(JsonNode payload, Class<S> stateType) {
        JavaType type = mapper.getTypeFactory().constructParametricType(TableSnapshot.class, stateType);
        return read(payload, type, "快照");
    }

    public ErrorPayload readError(JsonNode payload) {
        return read(payload, mapper.constructType(ErrorPayload.class), "错误");
    }

    private <T> T read(JsonNode payload, JavaType type, String what) {
        if (payload == null || payload.isNull()) {
            throw new MalformedMessageException(what + "载荷为空", null);
        }
        try {
            return mapper.readerFor(type).readValue(payload);
        } catch (IOException | IllegalArgumentException e) {
            throw new MalformedMessageException(what + "载荷无法解析", e);
        }
    }
}
