package com.chih.JStencil.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JStencil ObjectMapper 工厂类。
 * <p>
 * 提供统一的 Jackson ObjectMapper 配置，编译产物信封 (ArtifactEnvelope)、Mustache 产物内容
 * 和扩展签名都使用同一套序列化设置，保证相同输入产出字节级一致的 JSON。
 * </p>
 *
 * <h3>配置策略说明：</h3>
 * <ul>
 *   <li>FAIL_ON_UNKNOWN_PROPERTIES: false - 旧版本写入的产物多出字段时仍可读取</li>
 *   <li>WRITE_DATES_AS_TIMESTAMPS: disabled - 使用 ISO-8601 格式，便于排查缓存目录</li>
 * </ul>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public final class StencilObjectMapperFactory {

    private static final ObjectMapper SHARED = createJsonMapper();

    private StencilObjectMapperFactory() {
    }

    /**
     * 创建用于 JSON 的 ObjectMapper。
     *
     * @return 配置好的 ObjectMapper，线程安全可重用
     */
    public static ObjectMapper createJsonMapper() {
        ObjectMapper mapper = new ObjectMapper();

        /* 注册 Java 8 时间模块，支持 Instant 等时间类型 */
        mapper.registerModule(new JavaTimeModule());

        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        return mapper;
    }

    /**
     * 进程内共享的实例 (ObjectMapper 配置完成后是线程安全的)
     */
    public static ObjectMapper shared() {
        return SHARED;
    }
}
