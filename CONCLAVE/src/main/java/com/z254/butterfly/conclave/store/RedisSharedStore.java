package com.z254.butterfly.conclave.store;

import com.z254.butterfly.conclave.observability.ConclaveMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Redis-backed store shared by agents in any number of processes.
 *
 * <p>Mutations Redis runs as one command (RPUSH, LREM, HSET, HSETNX, HDEL, DEL) are issued
 * directly. Check-then-act and read-modify-write mutations go through {@link #optimistic},
 * which watches the key, reads, and commits with MULTI/EXEC, starting over whenever another
 * client touched the key in between.
 */
@Slf4j
public class RedisSharedStore implements SharedStore {

    private final StringRedisTemplate template;
    private final int maxCommitAttempts;
    private final ConclaveMetrics metrics;

    /**
     * @param maxCommitAttempts attempts per optimistic commit before giving up, 0 for no limit
     */
    public RedisSharedStore(StringRedisTemplate template, int maxCommitAttempts, ConclaveMetrics metrics) {
        if (maxCommitAttempts < 0) {
            throw new IllegalArgumentException("maxCommitAttempts must be >= 0");
        }
        this.template = template;
        this.maxCommitAttempts = maxCommitAttempts;
        this.metrics = metrics;
        log.info("Initialized Redis shared store (max commit attempts: {})",
                maxCommitAttempts == 0 ? "unbounded" : maxCommitAttempts);
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call(key, () -> template.opsForValue().get(key)));
    }

    @Override
    public void set(String key, String value) {
        run(key, () -> template.opsForValue().set(key, value));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call(key, () -> template.hasKey(key)));
    }

    @Override
    public void delete(String key) {
        run(key, () -> template.delete(key));
    }

    @Override
    public List<String> listRange(String key) {
        List<String> values = call(key, () -> template.opsForList().range(key, 0, -1));
        return values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public void listAppend(String key, String value) {
        run(key, () -> template.opsForList().rightPush(key, value));
    }

    @Override
    public boolean listAppendIfAbsent(String key, String value) {
        return optimistic(key, ops -> {
            List<String> current = ops.opsForList().range(key, 0, -1);
            if (current != null && current.contains(value)) {
                return Plan.readOnly(false);
            }
            return Plan.write(true, tx -> tx.opsForList().rightPush(key, value));
        });
    }

    @Override
    public void listRemove(String key, String value) {
        // Redis drops a list once its last element is removed.
        run(key, () -> template.opsForList().remove(key, 0, value));
    }

    @Override
    public Optional<String> mapGet(String key, String field) {
        return Optional.ofNullable(call(key, () -> template.<String, String>opsForHash().get(key, field)));
    }

    @Override
    public void mapSet(String key, String field, String value) {
        run(key, () -> template.opsForHash().put(key, field, value));
    }

    @Override
    public boolean mapSetIfAbsent(String key, String field, String value) {
        return Boolean.TRUE.equals(call(key, () -> template.opsForHash().putIfAbsent(key, field, value)));
    }

    @Override
    public void mapDelete(String key, String field) {
        run(key, () -> template.opsForHash().delete(key, field));
    }

    @Override
    public boolean mapExists(String key, String field) {
        return Boolean.TRUE.equals(call(key, () -> template.opsForHash().hasKey(key, field)));
    }

    @Override
    public Map<String, String> mapGetAll(String key) {
        Map<String, String> entries = call(key, () -> template.<String, String>opsForHash().entries(key));
        return entries == null ? Map.of() : new LinkedHashMap<>(entries);
    }

    @Override
    public Optional<String> mapUpdate(String key, String field, UnaryOperator<String> updater) {
        return optimistic(key, ops -> {
            String current = ops.<String, String>opsForHash().get(key, field);
            String updated = updater.apply(current);
            if (Objects.equals(current, updated)) {
                return Plan.readOnly(Optional.ofNullable(current));
            }
            if (updated == null) {
                return Plan.write(Optional.<String>empty(), tx -> tx.opsForHash().delete(key, field));
            }
            return Plan.write(Optional.of(updated), tx -> tx.opsForHash().put(key, field, updated));
        });
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = template.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(pong);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String backend() {
        return "redis";
    }

    /**
     * Runs a watched read followed by a transactional write, retrying on conflict.
     *
     * <p>The read phase sees the key as it is under WATCH and returns the result together
     * with the writes to queue. A plan without writes releases the watch and returns at
     * once. An aborted EXEC counts as a conflict and the whole read phase runs again.
     */
    <T> T optimistic(String key, Function<RedisOperations<String, String>, Plan<T>> readPhase) {
        int attempt = 0;
        while (true) {
            attempt++;
            Outcome<T> outcome = call(key, () -> template.execute(new SessionCallback<Outcome<T>>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> Outcome<T> execute(RedisOperations<K, V> operations) throws DataAccessException {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    Plan<T> plan = readPhase.apply(ops);
                    if (plan.writes() == null) {
                        ops.unwatch();
                        return new Outcome<>(true, plan.result());
                    }
                    ops.multi();
                    plan.writes().accept(ops);
                    List<Object> results = ops.exec();
                    boolean committed = results != null && !results.isEmpty();
                    return new Outcome<>(committed, plan.result());
                }
            }));
            if (outcome != null && outcome.committed()) {
                return outcome.result();
            }
            metrics.recordConflict();
            log.debug("Commit conflict on key {} (attempt {})", key, attempt);
            if (maxCommitAttempts > 0 && attempt >= maxCommitAttempts) {
                throw new StoreContentionException(key, attempt);
            }
        }
    }

    private <T> T call(String key, Supplier<T> command) {
        try {
            return command.get();
        } catch (DataAccessException e) {
            throw new StoreException("Redis command failed on key '" + key + "'", e);
        }
    }

    private void run(String key, Runnable command) {
        call(key, () -> {
            command.run();
            return null;
        });
    }

    /**
     * Result of a watched read, with the writes to commit or null when nothing changes.
     */
    record Plan<T>(T result, Consumer<RedisOperations<String, String>> writes) {

        static <T> Plan<T> readOnly(T result) {
            return new Plan<>(result, null);
        }

        static <T> Plan<T> write(T result, Consumer<RedisOperations<String, String>> writes) {
            return new Plan<>(result, writes);
        }
    }

    private record Outcome<T>(boolean committed, T result) {
    }
}
