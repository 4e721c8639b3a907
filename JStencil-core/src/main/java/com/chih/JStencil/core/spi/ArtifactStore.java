package com.chih.JStencil.core.spi;

import java.util.Optional;

/**
 * 编译产物存储 SPI
 * <p>
 * 以 Key 持久化编译产物，可以是文件系统、内存或者 KV 存储。
 * 同一个 Key 的写入内容总是相同的，实现只需要保证"写入后持久、要么完整可见要么不可见"。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public interface ArtifactStore {

    /**
     * 根据模板名称和 identity 生成存储 Key
     */
    String generateKey(String name, String identity);

    /**
     * 写入编译产物 (幂等覆盖)
     */
    void write(String key, String content);

    /**
     * 读取编译产物
     *
     * @return 不存在时返回 empty
     */
    Optional<String> load(String key);

    /**
     * 获取编译产物的修改时间
     *
     * @return epoch 毫秒，不存在时返回 0
     */
    long getTimestamp(String key);
}
