package com.z254.butterfly.conclave.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Key-value store backing contexts and the registry.
 *
 * <p>Values are strings. A key holds either a plain value, a list or a map, and every
 * mutation of a single key is atomic with respect to other callers of the same store,
 * whether they run in this process or elsewhere.
 */
public interface SharedStore {

    Optional<String> get(String key);

    void set(String key, String value);

    boolean exists(String key);

    void delete(String key);

    /**
     * Whole list, oldest first. Empty when the key is absent.
     */
    List<String> listRange(String key);

    void listAppend(String key, String value);

    /**
     * Appends unless the list already contains the value.
     *
     * @return true if the value was appended
     */
    boolean listAppendIfAbsent(String key, String value);

    /**
     * Removes every occurrence of the value. A list left empty disappears.
     */
    void listRemove(String key, String value);

    Optional<String> mapGet(String key, String field);

    void mapSet(String key, String field, String value);

    /**
     * @return true if the field was absent and has been set
     */
    boolean mapSetIfAbsent(String key, String field, String value);

    void mapDelete(String key, String field);

    boolean mapExists(String key, String field);

    /**
     * All fields, in insertion order where the backend keeps it.
     */
    Map<String, String> mapGetAll(String key);

    /**
     * Read-modify-write of one map field.
     *
     * <p>The updater receives the current value, or null when the field is absent, and
     * returns the new value. Returning null deletes the field; returning a value equal to
     * the current one commits nothing. The updater may run more than once and must not
     * have side effects.
     *
     * @return the value left in the field
     */
    Optional<String> mapUpdate(String key, String field, UnaryOperator<String> updater);

    boolean isAvailable();

    /**
     * Short backend name, for diagnostics.
     */
    String backend();
}
