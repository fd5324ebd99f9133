package com.chainpulse.analytics.adapter;

import com.chainpulse.common.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@Slf4j
public class ComputeAdapterRegistry {

    private final Map<String, ComputeAdapter> adapters;

    public ComputeAdapterRegistry(List<ComputeAdapter> adapters) {
        Map<String, ComputeAdapter> byName = new TreeMap<>();
        for (ComputeAdapter adapter : adapters) {
            ComputeAdapter previous = byName.putIfAbsent(adapter.getName(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate compute adapter name: " + adapter.getName());
            }
        }
        this.adapters = Collections.unmodifiableMap(byName);
        log.info("Registered compute adapters: {}", this.adapters.keySet());
    }

    /**
     * @throws NotFoundException if no adapter has that name
     */
    public ComputeAdapter get(String name) {
        ComputeAdapter adapter = name != null ? adapters.get(name) : null;
        if (adapter == null) {
            throw new NotFoundException("Metric", name);
        }
        return adapter;
    }
}
