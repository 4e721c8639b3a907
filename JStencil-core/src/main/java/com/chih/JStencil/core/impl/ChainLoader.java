package com.chih.JStencil.core.impl;

import com.chih.JStencil.core.exception.LoaderException;
import com.chih.JStencil.core.spi.Loader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 按顺序委托给多个 Loader，第一个认识该模板的 Loader 生效
 *
 * @author lizhiyuan
 * @since 2026/10/19
 */
public class ChainLoader implements Loader {

    private final List<Loader> loaders = new CopyOnWriteArrayList<>();

    public ChainLoader(List<? extends Loader> loaders) {
        if (loaders != null) {
            loaders.forEach(this::addLoader);
        }
    }

    public void addLoader(Loader loader) {
        if (loader == null) {
            throw new IllegalArgumentException("Loader cannot be null");
        }
        loaders.add(loader);
    }

    public List<Loader> getLoaders() {
        return Collections.unmodifiableList(loaders);
    }

    @Override
    public String getSource(String name) {
        return firstMatch(name, loader -> loader.getSource(name));
    }

    @Override
    public String getCacheKey(String name) {
        return firstMatch(name, loader -> loader.getCacheKey(name));
    }

    @Override
    public boolean isFresh(String name, long time) {
        return firstMatch(name, loader -> loader.isFresh(name, time));
    }

    @Override
    public boolean exists(String name) {
        for (Loader loader : loaders) {
            if (loader.exists(name)) {
                return true;
            }
        }
        return false;
    }

    private <R> R firstMatch(String name, Function<Loader, R> action) {
        List<String> messages = new ArrayList<>();
        for (Loader loader : loaders) {
            if (!loader.exists(name)) {
                continue;
            }
            try {
                return action.apply(loader);
            } catch (LoaderException e) {
                messages.add(e.getMessage());
            }
        }
        if (messages.isEmpty()) {
            throw new LoaderException(String.format("Template \"%s\" is not defined.", name));
        }
        throw new LoaderException(String.format("Template \"%s\" is not defined (%s).", name,
                String.join(", ", messages)));
    }
}
