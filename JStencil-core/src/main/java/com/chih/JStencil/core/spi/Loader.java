package com.chih.JStencil.core.spi;

import com.chih.JStencil.core.exception.LoaderException;

/**
 * 模板来源接口 (SPI)
 * <p>
 * 负责把模板名称解析为源码，并提供缓存 Key 和新鲜度信息。
 * 支持扩展不同的存储源（如 File, Classpath, Spring Resource, DB）。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public interface Loader {

    /**
     * 获取模板源码
     *
     * @param name 模板名称
     * @return 模板源码
     * @throws LoaderException 模板不存在或无法读取
     */
    String getSource(String name);

    /**
     * 获取模板的缓存 Key
     * <p>
     * 同一个 Key 必须对应同一份模板，Key 会参与编译产物 identity 的计算。
     * </p>
     *
     * @throws LoaderException 模板不存在
     */
    String getCacheKey(String name);

    /**
     * 判断模板在给定时间之后是否未被修改
     *
     * @param name 模板名称
     * @param time 缓存产物的时间戳 (epoch 毫秒)
     * @throws LoaderException 模板不存在
     */
    boolean isFresh(String name, long time);

    /**
     * 判断模板是否存在
     */
    default boolean exists(String name) {
        try {
            getSource(name);
            return true;
        } catch (LoaderException e) {
            return false;
        }
    }
}
