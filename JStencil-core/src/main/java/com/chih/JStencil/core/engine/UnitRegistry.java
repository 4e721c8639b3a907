package com.chih.JStencil.core.engine;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * 已激活编译产物的注册表
 * <p>
 * 同一个 identity 在一个注册表内最多激活一次，激活不可撤销。
 * 默认每个 Environment 持有自己的注册表；多个 Environment 需要共享激活结果时，
 * 通过 {@link EnvironmentOptions#setUnitRegistry} 传入同一个实例。
 * </p>
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class UnitRegistry {

    private final ConcurrentMap<String, TemplateUnit> units = new ConcurrentHashMap<>();

    public boolean isDefined(String identity) {
        return units.containsKey(identity);
    }

    /**
     * @return 未激活时返回 null
     */
    public TemplateUnit get(String identity) {
        return units.get(identity);
    }

    /**
     * 原子地"检查并激活"：已激活时直接返回已有的单元，activator 不会被调用
     * <p>
     * activator 抛出异常时不会留下任何注册记录。
     * </p>
     */
    public TemplateUnit define(String identity, Supplier<TemplateUnit> activator) {
        return units.computeIfAbsent(identity, key -> activator.get());
    }

    public int size() {
        return units.size();
    }
}
