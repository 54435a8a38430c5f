package com.hivestate.core.cache;

import com.hivestate.core.model.Agent;
import com.hivestate.core.model.StreamMessage;
import com.hivestate.core.model.Task;
import com.hivestate.core.store.ErrorKind;
import com.hivestate.core.store.JsonCodec;
import com.hivestate.core.store.StoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link EphemeralStore} over Redis through Spring Data Redis.
 * <p>
 * Values are JSON documents written with SET + EX. Stream fields are flat strings; map and
 * list values are JSON-encoded on the way in and parsed back on the way out.
 */
public class RedisEphemeralStore implements EphemeralStore {

    private static final Logger log = LoggerFactory.getLogger(RedisEphemeralStore.class);

    static final Map<String, List<String>> STREAM_GROUPS = Map.of(
            CacheKeys.TASK_STREAM, List.of(CacheKeys.TASK_PROCESSORS_GROUP, CacheKeys.PRIORITY_PROCESSORS_GROUP),
            CacheKeys.EVENT_STREAM, List.of(CacheKeys.MONITORING_GROUP, CacheKeys.ANALYTICS_GROUP));

    private final StringRedisTemplate redis;
    private final JsonCodec json;
    private final Clock clock;
    private final EphemeralStoreProperties properties;

    public RedisEphemeralStore(StringRedisTemplate redis, JsonCodec json, Clock clock,
                               EphemeralStoreProperties properties) {
        this.redis = Objects.requireNonNull(redis, "StringRedisTemplate must not be null");
        this.json = Objects.requireNonNull(json, "JsonCodec must not be null");
        this.clock = Objects.requireNonNull(clock, "Clock must not be null");
        this.properties = Objects.requireNonNull(properties, "EphemeralStoreProperties must not be null");
    }

    @Override
    public boolean initialize() {
        try {
            String pong = redis.execute((RedisCallback<String>) RedisConnection::ping);
            log.info("Connected to Redis ({})", pong);
        } catch (DataAccessException e) {
            log.error("Failed to connect to Redis: {}", e.getMessage());
            return false;
        }
        boolean ok = true;
        for (var entry : STREAM_GROUPS.entrySet()) {
            for (String group : entry.getValue()) {
                ok &= createGroup(entry.getKey(), group);
            }
        }
        return ok;
    }

    private boolean createGroup(String stream, String group) {
        byte[] key = stream.getBytes(StandardCharsets.UTF_8);
        try {
            redis.execute((RedisCallback<String>) connection ->
                    connection.streamCommands().xGroupCreate(key, group, ReadOffset.from("0"), true));
            log.debug("Created consumer group '{}' on stream '{}'", group, stream);
            return true;
        } catch (DataAccessException e) {
            String cause = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
            if (cause != null && cause.contains("BUSYGROUP")) {
                log.debug("Consumer group '{}' already exists on '{}'", group, stream);
                return true;
            }
            log.warn("Failed to create consumer group '{}' on '{}': {}", group, stream, cause);
            return false;
        }
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    // ── Agent and task cache ─────────────────────────────────────────────

    @Override
    public StoreResult<Boolean> setAgentState(Agent agent, Duration ttl) {
        return put(CacheKeys.agentState(agent.agentId()), agent, ttlOr(ttl, properties.getDefaultTtl()));
    }

    @Override
    public StoreResult<Optional<Agent>> getAgentState(String agentId) {
        return fetch(CacheKeys.agentState(agentId), Agent.class);
    }

    @Override
    public StoreResult<Boolean> deleteAgentState(String agentId) {
        return delete(CacheKeys.agentState(agentId));
    }

    @Override
    public StoreResult<Integer> batchCacheAgents(Collection<Agent> agents, Duration ttl) {
        if (agents.isEmpty()) {
            return StoreResult.success(0);
        }
        Duration effectiveTtl = ttlOr(ttl, properties.getDefaultTtl());
        Map<String, String> entries = new LinkedHashMap<>();
        try {
            for (Agent agent : agents) {
                entries.put(CacheKeys.agentState(agent.agentId()), json.write(agent));
            }
        } catch (IllegalArgumentException e) {
            log.error("Failed to encode agents for batch cache", e);
            return StoreResult.failure(ErrorKind.INTEGRITY, e.getMessage());
        }
        try {
            redis.executePipelined(new SessionCallback<Object>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> Object execute(RedisOperations<K, V> operations) {
                    RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                    entries.forEach((key, value) -> ops.opsForValue().set(key, value, effectiveTtl));
                    return null;
                }
            });
            log.debug("Batch cached {} agents", entries.size());
            return StoreResult.success(entries.size());
        } catch (DataAccessException e) {
            return failure("batch cache " + entries.size() + " agents", e);
        }
    }

    @Override
    public StoreResult<Boolean> cacheTask(Task task, Duration ttl) {
        return put(CacheKeys.task(task.taskId()), task, ttlOr(ttl, properties.getTaskTtl()));
    }

    @Override
    public StoreResult<Optional<Task>> getCachedTask(String taskId) {
        return fetch(CacheKeys.task(taskId), Task.class);
    }

    @Override
    public StoreResult<Boolean> deleteCachedTask(String taskId) {
        return delete(CacheKeys.task(taskId));
    }

    // ── Sessions and coordination ────────────────────────────────────────

    @Override
    public StoreResult<Boolean> createSession(String sessionId, Map<String, Object> data, Duration ttl) {
        return put(CacheKeys.session(sessionId), data, ttlOr(ttl, properties.getSessionTtl()));
    }

    @Override
    public StoreResult<Optional<Map<String, Object>>> getSession(String sessionId) {
        return fetchMap(CacheKeys.session(sessionId));
    }

    @Override
    public StoreResult<Boolean> extendSession(String sessionId, Duration ttl) {
        try {
            Boolean extended = redis.expire(CacheKeys.session(sessionId), ttlOr(ttl, properties.getSessionTtl()));
            return StoreResult.success(Boolean.TRUE.equals(extended));
        } catch (DataAccessException e) {
            return failure("extend session " + sessionId, e);
        }
    }

    @Override
    public StoreResult<Boolean> setCoordinationState(String operationId, Map<String, Object> state, Duration ttl) {
        return put(CacheKeys.coordination(operationId), state, ttlOr(ttl, properties.getCoordinationTtl()));
    }

    @Override
    public StoreResult<Optional<Map<String, Object>>> getCoordinationState(String operationId) {
        return fetchMap(CacheKeys.coordination(operationId));
    }

    // ── Streams ──────────────────────────────────────────────────────────

    @Override
    public StoreResult<String> queueTask(Map<String, Object> task) {
        Map<String, Object> fields = new LinkedHashMap<>(task);
        fields.put("queued_at", clock.instant().toString());
        fields.put("queue_id", UUID.randomUUID().toString());
        return append(CacheKeys.TASK_STREAM, fields);
    }

    @Override
    public StoreResult<List<StreamMessage>> consumeTasks(String group, String consumer, int count) {
        return read(CacheKeys.TASK_STREAM, group, consumer, count);
    }

    @Override
    public StoreResult<Boolean> acknowledgeTask(String group, String messageId) {
        return acknowledge(CacheKeys.TASK_STREAM, group, messageId);
    }

    @Override
    public StoreResult<String> publishEvent(Map<String, Object> event) {
        Map<String, Object> fields = new LinkedHashMap<>(event);
        fields.put("published_at", clock.instant().toString());
        fields.put("event_id", UUID.randomUUID().toString());
        return append(CacheKeys.EVENT_STREAM, fields);
    }

    @Override
    public StoreResult<List<StreamMessage>> consumeEvents(String group, String consumer, int count) {
        return read(CacheKeys.EVENT_STREAM, group, consumer, count);
    }

    @Override
    public StoreResult<Boolean> acknowledgeEvent(String group, String messageId) {
        return acknowledge(CacheKeys.EVENT_STREAM, group, messageId);
    }

    private StoreResult<String> append(String stream, Map<String, Object> fields) {
        Map<String, String> encoded;
        try {
            encoded = encodeFields(fields);
        } catch (IllegalArgumentException e) {
            log.error("Failed to encode message for stream '{}'", stream, e);
            return StoreResult.failure(ErrorKind.INTEGRITY, e.getMessage());
        }
        try {
            StreamOperations<String, String, String> ops = redis.opsForStream();
            RecordId id = ops.add(MapRecord.create(stream, encoded));
            if (id == null) {
                return StoreResult.failure(ErrorKind.CONNECTIVITY, "No message id returned by XADD");
            }
            ops.trim(stream, properties.getStreamMaxLength(), true);
            log.debug("Appended message {} to '{}'", id.getValue(), stream);
            return StoreResult.success(id.getValue());
        } catch (DataAccessException e) {
            return failure("append to " + stream, e);
        }
    }

    private StoreResult<List<StreamMessage>> read(String stream, String group, String consumer, int count) {
        try {
            StreamOperations<String, String, String> ops = redis.opsForStream();
            List<MapRecord<String, String, String>> records = ops.read(
                    Consumer.from(group, consumer),
                    StreamReadOptions.empty().count(count).block(properties.getBlockTimeout()),
                    StreamOffset.create(stream, ReadOffset.lastConsumed()));
            if (records == null || records.isEmpty()) {
                return StoreResult.success(List.of());
            }
            List<StreamMessage> messages = new ArrayList<>(records.size());
            for (MapRecord<String, String, String> record : records) {
                messages.add(new StreamMessage(stream, record.getId().getValue(), decodeFields(record.getValue())));
            }
            log.debug("Consumer '{}' of group '{}' read {} messages from '{}'",
                    consumer, group, messages.size(), stream);
            return StoreResult.success(messages);
        } catch (DataAccessException e) {
            return failure("read " + stream + " as " + group + "/" + consumer, e);
        }
    }

    private StoreResult<Boolean> acknowledge(String stream, String group, String messageId) {
        try {
            Long acked = redis.opsForStream().acknowledge(stream, group, messageId);
            return StoreResult.success(acked != null && acked > 0);
        } catch (DataAccessException e) {
            return failure("acknowledge " + messageId + " on " + stream, e);
        }
    }

    Map<String, String> encodeFields(Map<String, Object> fields) {
        Map<String, String> encoded = new LinkedHashMap<>();
        fields.forEach((name, value) -> {
            if (value == null) {
                encoded.put(name, "");
            } else if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
                encoded.put(name, json.write(value));
            } else {
                encoded.put(name, value.toString());
            }
        });
        return encoded;
    }

    Map<String, Object> decodeFields(Map<String, String> fields) {
        Map<String, Object> decoded = new LinkedHashMap<>();
        fields.forEach((name, value) -> decoded.put(name, json.readLenient(value)));
        return decoded;
    }

    // ── Metrics ──────────────────────────────────────────────────────────

    @Override
    public StoreResult<Long> incrementMetric(String name, long delta) {
        String key = CacheKeys.metric(name);
        try {
            Long value = redis.opsForValue().increment(key, delta);
            redis.expire(key, properties.getMetricTtl());
            return StoreResult.success(value == null ? 0L : value);
        } catch (DataAccessException e) {
            return failure("increment metric " + name, e);
        }
    }

    @Override
    public StoreResult<Long> getMetric(String name) {
        try {
            String value = redis.opsForValue().get(CacheKeys.metric(name));
            return StoreResult.success(value == null ? 0L : Long.parseLong(value));
        } catch (NumberFormatException e) {
            log.warn("Metric '{}' holds a non-numeric value", name);
            return StoreResult.failure(ErrorKind.INTEGRITY, e.getMessage());
        } catch (DataAccessException e) {
            return failure("read metric " + name, e);
        }
    }

    // ── Health ───────────────────────────────────────────────────────────

    @Override
    public EphemeralStoreHealth healthCheck() {
        Instant timestamp = clock.instant();
        try {
            long start = System.nanoTime();
            redis.execute((RedisCallback<String>) RedisConnection::ping);
            double pingMs = (System.nanoTime() - start) / 1_000_000.0;

            Map<String, EphemeralStoreHealth.StreamInfo> streams = new LinkedHashMap<>();
            StreamOperations<String, String, String> ops = redis.opsForStream();
            for (String stream : STREAM_GROUPS.keySet()) {
                streams.put(stream, streamInfo(ops, stream));
            }
            return new EphemeralStoreHealth(timestamp, true, true, pingMs, streams, null);
        } catch (DataAccessException e) {
            log.warn("Ephemeral store health check failed: {}", e.getMessage());
            return EphemeralStoreHealth.down(timestamp, true, e.getMessage());
        }
    }

    private static EphemeralStoreHealth.StreamInfo streamInfo(StreamOperations<String, String, String> ops,
                                                              String stream) {
        Long length = ops.size(stream);
        int groups;
        try {
            groups = ops.groups(stream).groupCount();
        } catch (DataAccessException e) {
            // XINFO fails for a stream that was never created
            groups = 0;
        }
        return new EphemeralStoreHealth.StreamInfo(length == null ? 0 : length, groups);
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private StoreResult<Boolean> put(String key, Object value, Duration ttl) {
        String encoded;
        try {
            encoded = json.write(value);
        } catch (IllegalArgumentException e) {
            log.error("Failed to encode value for '{}'", key, e);
            return StoreResult.failure(ErrorKind.INTEGRITY, e.getMessage());
        }
        try {
            redis.opsForValue().set(key, encoded, ttl);
            return StoreResult.done();
        } catch (DataAccessException e) {
            return failure("write " + key, e);
        }
    }

    private <T> StoreResult<Optional<T>> fetch(String key, Class<T> type) {
        String value;
        try {
            value = redis.opsForValue().get(key);
        } catch (DataAccessException e) {
            return failure("read " + key, e);
        }
        if (value == null) {
            return StoreResult.success(Optional.empty());
        }
        try {
            return StoreResult.success(Optional.of(json.read(value, type)));
        } catch (IllegalArgumentException e) {
            log.warn("Discarding undecodable cache entry '{}': {}", key, e.getMessage());
            return StoreResult.success(Optional.empty());
        }
    }

    private StoreResult<Optional<Map<String, Object>>> fetchMap(String key) {
        String value;
        try {
            value = redis.opsForValue().get(key);
        } catch (DataAccessException e) {
            return failure("read " + key, e);
        }
        if (value == null) {
            return StoreResult.success(Optional.empty());
        }
        try {
            return StoreResult.success(Optional.of(json.readMap(value)));
        } catch (IllegalArgumentException e) {
            log.warn("Discarding undecodable cache entry '{}': {}", key, e.getMessage());
            return StoreResult.success(Optional.empty());
        }
    }

    private StoreResult<Boolean> delete(String key) {
        try {
            return StoreResult.success(Boolean.TRUE.equals(redis.delete(key)));
        } catch (DataAccessException e) {
            return failure("delete " + key, e);
        }
    }

    private static Duration ttlOr(Duration ttl, Duration fallback) {
        return ttl != null ? ttl : fallback;
    }

    private static <T> StoreResult<T> failure(String operation, DataAccessException e) {
        ErrorKind kind = classify(e);
        log.error("Failed to {} ({}): {}", operation, kind, e.getMessage());
        return StoreResult.failure(kind, e.getMessage());
    }

    static ErrorKind classify(DataAccessException e) {
        if (e instanceof QueryTimeoutException) {
            return ErrorKind.TIMEOUT;
        }
        return ErrorKind.CONNECTIVITY;
    }
}
