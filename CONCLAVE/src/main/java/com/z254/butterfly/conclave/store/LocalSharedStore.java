package com.z254.butterfly.conclave.store;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * In-memory store for agents sharing one process.
 *
 * <p>All access goes through the instance monitor, so each operation is atomic with
 * respect to agents running on other threads.
 */
@Slf4j
public class LocalSharedStore implements SharedStore {

    private final Map<String, Object> data = new HashMap<>();

    public LocalSharedStore() {
        log.info("Initialized in-memory shared store");
    }

    @Override
    public synchronized Optional<String> get(String key) {
        Object value = data.get(key);
        if (value == null) {
            return Optional.empty();
        }
        return Optional.of(expect(key, value, String.class));
    }

    @Override
    public synchronized void set(String key, String value) {
        Objects.requireNonNull(value, "value");
        Object current = data.get(key);
        if (current != null) {
            expect(key, current, String.class);
        }
        data.put(key, value);
    }

    @Override
    public synchronized boolean exists(String key) {
        return data.containsKey(key);
    }

    @Override
    public synchronized void delete(String key) {
        data.remove(key);
    }

    @Override
    public synchronized List<String> listRange(String key) {
        List<String> list = list(key, false);
        return list == null ? List.of() : List.copyOf(list);
    }

    @Override
    public synchronized void listAppend(String key, String value) {
        list(key, true).add(Objects.requireNonNull(value, "value"));
    }

    @Override
    public synchronized boolean listAppendIfAbsent(String key, String value) {
        List<String> list = list(key, true);
        if (list.contains(value)) {
            return false;
        }
        list.add(Objects.requireNonNull(value, "value"));
        return true;
    }

    @Override
    public synchronized void listRemove(String key, String value) {
        List<String> list = list(key, false);
        if (list == null) {
            return;
        }
        list.removeIf(value::equals);
        if (list.isEmpty()) {
            data.remove(key);
        }
    }

    @Override
    public synchronized Optional<String> mapGet(String key, String field) {
        Map<String, String> map = map(key, false);
        return map == null ? Optional.empty() : Optional.ofNullable(map.get(field));
    }

    @Override
    public synchronized void mapSet(String key, String field, String value) {
        map(key, true).put(field, Objects.requireNonNull(value, "value"));
    }

    @Override
    public synchronized boolean mapSetIfAbsent(String key, String field, String value) {
        Map<String, String> map = map(key, true);
        if (map.containsKey(field)) {
            return false;
        }
        map.put(field, Objects.requireNonNull(value, "value"));
        return true;
    }

    @Override
    public synchronized void mapDelete(String key, String field) {
        Map<String, String> map = map(key, false);
        if (map == null) {
            return;
        }
        map.remove(field);
        if (map.isEmpty()) {
            data.remove(key);
        }
    }

    @Override
    public synchronized boolean mapExists(String key, String field) {
        Map<String, String> map = map(key, false);
        return map != null && map.containsKey(field);
    }

    @Override
    public synchronized Map<String, String> mapGetAll(String key) {
        Map<String, String> map = map(key, false);
        return map == null ? Map.of() : new LinkedHashMap<>(map);
    }

    @Override
    public synchronized Optional<String> mapUpdate(String key, String field, UnaryOperator<String> updater) {
        Map<String, String> existing = map(key, false);
        String current = existing == null ? null : existing.get(field);
        String updated = updater.apply(current);
        if (Objects.equals(current, updated)) {
            return Optional.ofNullable(current);
        }
        if (updated == null) {
            mapDelete(key, field);
        } else {
            map(key, true).put(field, updated);
        }
        return Optional.ofNullable(updated);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public String backend() {
        return "local";
    }

    @SuppressWarnings("unchecked")
    private List<String> list(String key, boolean create) {
        Object value = data.get(key);
        if (value == null) {
            if (!create) {
                return null;
            }
            List<String> list = new ArrayList<>();
            data.put(key, list);
            return list;
        }
        return expect(key, value, List.class);
    }

    @SuppressWarnings("unchecked")
    private Map<String, String> map(String key, boolean create) {
        Object value = data.get(key);
        if (value == null) {
            if (!create) {
                return null;
            }
            Map<String, String> map = new LinkedHashMap<>();
            data.put(key, map);
            return map;
        }
        return expect(key, value, Map.class);
    }

    private static <T> T expect(String key, Object value, Class<T> type) {
        if (!type.isInstance(value)) {
            throw new StoreException("Key '" + key + "' holds a " + value.getClass().getSimpleName()
                    + ", expected " + type.getSimpleName());
        }
        return type.cast(value);
    }
}
