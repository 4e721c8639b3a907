package com.chih.JStencil.spring.health;

import com.chih.JStencil.core.domain.CacheTarget;
import com.chih.JStencil.core.engine.Environment;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JStencil 健康检查指示器
 * 文件系统缓存目录存在但不可写时标记为 DOWN
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class JStencilHealthIndicator extends AbstractHealthIndicator {

    private final Environment environment;

    public JStencilHealthIndicator(Environment environment) {
        this.environment = environment;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        CacheTarget target = environment.getCacheTarget();

        if (target.getKind() == CacheTarget.Kind.FILESYSTEM && !isWritable(target.getPath())) {
            builder.down().withDetail("message", "Cache directory is not writable.");
        } else {
            builder.up();
        }
        builder.withDetail("cache", target.toString())
                .withDetail("loadedTemplates", environment.getLoadedTemplateCount())
                .withDetail("extensionsInitialized", environment.getExtensionSet().isInitialized())
                .withDetail("autoReload", environment.isAutoReload());
    }

    // 目录尚未创建时检查最近的已存在父目录
    private boolean isWritable(Path directory) {
        Path current = directory.toAbsolutePath();
        while (current != null && !Files.exists(current)) {
            current = current.getParent();
        }
        return current != null && Files.isDirectory(current) && Files.isWritable(current);
    }
}
