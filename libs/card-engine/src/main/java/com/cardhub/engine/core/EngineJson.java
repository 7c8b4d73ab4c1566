package com.cardhub.engine.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * 引擎内共享的 Jackson 配置。
 * 状态深拷贝与快照编解码都走同一个 ObjectMapper，保证两边字段一致。
 */
public final class EngineJson {

    public static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    private EngineJson() {
    }

    /** 经 JSON 树做一次深拷贝 */
    public static <T> T deepCopy(T value, Class<T> type) {
        if (value == null) return null;
        return MAPPER.convertValue(MAPPER.valueToTree(value), type);
    }
}
