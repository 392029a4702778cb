package com.crescent.gateway.core.dialect;

import com.crescent.gateway.core.error.GatewayException;
import com.crescent.gateway.core.model.Dialect;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 方言适配器工厂，按入站路径对应的方言选择适配器
 */
@Slf4j
@Component
public class DialectAdapterFactory {

    private final Map<Dialect, DialectAdapter> adapters = new EnumMap<>(Dialect.class);

    public DialectAdapterFactory(List<DialectAdapter> dialectAdapters) {
        for (DialectAdapter adapter : dialectAdapters) {
            DialectAdapter previous = adapters.put(adapter.dialect(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate dialect adapter for " + adapter.dialect()
                        + ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        log.info("Registered dialect adapters: {}", adapters.keySet());
    }

    public DialectAdapter getAdapter(Dialect dialect) {
        DialectAdapter adapter = adapters.get(dialect);
        if (adapter == null) {
            throw GatewayException.internal(new IllegalStateException("No dialect adapter for " + dialect));
        }
        return adapter;
    }
}
