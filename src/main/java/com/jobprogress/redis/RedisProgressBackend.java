package com.jobprogress.redis;

import com.jobprogress.core.CompletionOutcome;
import com.jobprogress.core.JobRecord;
import com.jobprogress.core.JsonCodec;
import com.jobprogress.core.ProgressBackend;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.resps.Tuple;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Progress backend on a Redis server.
 *
 * <p>Each job lives in two hashes. {@code <jobId>-metadata} holds the fields {@code total},
 * {@code remaining}, {@code failed} and {@code metadata} (JSON), plus {@code topic} only when
 * the job was registered with one. {@code <jobId>-parts} maps each pending index to its
 * descriptor JSON. Enumeration runs off the sorted set {@code progress:jobs}, scored by a
 * creation counter.</p>
 *
 * <p>Every multi-key mutation is a single Lua script, which Redis executes atomically.
 * The completion script gates the {@code HINCRBY} on the result of {@code HDEL}, so a
 * duplicate completion never decrements twice. Redis client exceptions are not caught
 * here and reach the caller unchanged.</p>
 */
public class RedisProgressBackend implements ProgressBackend {
    private static final Logger logger = Logger.getLogger(RedisProgressBackend.class.getName());

    static final String JOB_INDEX_KEY = "progress:jobs";
    static final String JOB_SEQUENCE_KEY = "progress:jobs:seq";

    // KEYS: metadata, parts, index, sequence. ARGV: jobId, total, hasTopic ('1' or '0'), topic, descriptors...
    static final String CREATE_JOB_SCRIPT =
            "redis.call('DEL', KEYS[1], KEYS[2])\n" +
            "redis.call('HSET', KEYS[1], 'total', ARGV[2], 'remaining', ARGV[2], 'failed', '0', 'metadata', '{}')\n" +
            "if ARGV[3] == '1' then redis.call('HSET', KEYS[1], 'topic', ARGV[4]) end\n" +
            "for i = 5, #ARGV do\n" +
            "  redis.call('HSET', KEYS[2], tostring(i - 5), ARGV[i])\n" +
            "end\n" +
            "if not redis.call('ZSCORE', KEYS[3], ARGV[1]) then\n" +
            "  redis.call('ZADD', KEYS[3], redis.call('INCR', KEYS[4]), ARGV[1])\n" +
            "end\n" +
            "return 1";

    // KEYS: metadata, parts, index. ARGV: jobId, index, deleteWhenDone ('1' or '0')
    static final String COMPLETE_PART_SCRIPT =
            "local total = redis.call('HGET', KEYS[1], 'total')\n" +
            "if not total then return -1 end\n" +
            "if tonumber(ARGV[2]) >= tonumber(total) then return -2 end\n" +
            "if redis.call('HDEL', KEYS[2], ARGV[2]) == 0 then return 0 end\n" +
            "local remaining = redis.call('HINCRBY', KEYS[1], 'remaining', -1)\n" +
            "if remaining > 0 then return 1 end\n" +
            "if ARGV[3] == '1' then\n" +
            "  redis.call('DEL', KEYS[1], KEYS[2])\n" +
            "  redis.call('ZREM', KEYS[3], ARGV[1])\n" +
            "end\n" +
            "return 2";

    // KEYS: metadata. ARGV: updates JSON, markFailed ('1' or '0')
    static final String MERGE_METADATA_SCRIPT =
            "if redis.call('EXISTS', KEYS[1]) == 0 then return 0 end\n" +
            "local merged = cjson.decode(redis.call('HGET', KEYS[1], 'metadata') or '{}')\n" +
            "for k, v in pairs(cjson.decode(ARGV[1])) do merged[k] = v end\n" +
            "redis.call('HSET', KEYS[1], 'metadata', cjson.encode(merged))\n" +
            "if ARGV[2] == '1' then redis.call('HSET', KEYS[1], 'failed', '1') end\n" +
            "return 1";

    // KEYS: metadata, parts. ARGV: index
    static final String PART_STATE_SCRIPT =
            "local total = redis.call('HGET', KEYS[1], 'total')\n" +
            "if not total then return -1 end\n" +
            "if tonumber(ARGV[1]) >= tonumber(total) then return -2 end\n" +
            "return redis.call('HEXISTS', KEYS[2], ARGV[1])";

    // KEYS: metadata, parts, index. ARGV: jobId. Returns 1 if the job existed.
    static final String DELETE_JOB_SCRIPT =
            "local removed = redis.call('DEL', KEYS[1])\n" +
            "redis.call('DEL', KEYS[2])\n" +
            "redis.call('ZREM', KEYS[3], ARGV[1])\n" +
            "return removed";

    private final JedisPool pool;

    public RedisProgressBackend(JedisPool pool) {
        this.pool = pool;
    }

    /**
     * Open a pooled connection to a Redis server.
     *
     * @param host server host
     * @param port server port
     * @param db logical database number
     * @return a backend owning the new pool
     */
    public static RedisProgressBackend connect(String host, int port, int db) {
        logger.info("Connecting to Redis at " + host + ":" + port + "/" + db);
        JedisPool pool = new JedisPool(new JedisPoolConfig(), host, port, Protocol.DEFAULT_TIMEOUT, null, db);
        return new RedisProgressBackend(pool);
    }

    static String metadataKey(String jobId) {
        return jobId + "-metadata";
    }

    static String partsKey(String jobId) {
        return jobId + "-parts";
    }

    @Override
    public void createJob(String jobId, String topic, List<String> encodedParts) {
        List<String> args = new ArrayList<>(encodedParts.size() + 4);
        args.add(jobId);
        args.add(String.valueOf(encodedParts.size()));
        args.add(topic == null ? "0" : "1");
        args.add(topic == null ? "" : topic);
        args.addAll(encodedParts);

        try (Jedis jedis = pool.getResource()) {
            jedis.eval(CREATE_JOB_SCRIPT,
                    List.of(metadataKey(jobId), partsKey(jobId), JOB_INDEX_KEY, JOB_SEQUENCE_KEY), args);
        }
    }

    @Override
    public CompletionOutcome completePart(String jobId, int index, boolean deleteWhenDone) {
        try (Jedis jedis = pool.getResource()) {
            Object reply = jedis.eval(COMPLETE_PART_SCRIPT,
                    List.of(metadataKey(jobId), partsKey(jobId), JOB_INDEX_KEY),
                    List.of(jobId, String.valueOf(index), deleteWhenDone ? "1" : "0"));
            return CompletionOutcome.fromCode((Long) reply);
        }
    }

    @Override
    public Optional<JobRecord> readJob(String jobId) {
        Map<String, String> fields;
        try (Jedis jedis = pool.getResource()) {
            fields = jedis.hgetAll(metadataKey(jobId));
        }
        if (fields == null || fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new JobRecord(
                jobId,
                Integer.parseInt(fields.getOrDefault("total", "0")),
                Integer.parseInt(fields.getOrDefault("remaining", "0")),
                "1".equals(fields.get("failed")),
                JsonCodec.decodeStrings(fields.get("metadata")),
                fields.get("topic")));
    }

    @Override
    public boolean mergeMetadata(String jobId, Map<String, String> updates, boolean markFailed) {
        try (Jedis jedis = pool.getResource()) {
            Object reply = jedis.eval(MERGE_METADATA_SCRIPT,
                    List.of(metadataKey(jobId)),
                    List.of(JsonCodec.encode(updates), markFailed ? "1" : "0"));
            return ((Long) reply) == 1L;
        }
    }

    @Override
    public PartState partState(String jobId, int index) {
        long reply;
        try (Jedis jedis = pool.getResource()) {
            reply = (Long) jedis.eval(PART_STATE_SCRIPT,
                    List.of(metadataKey(jobId), partsKey(jobId)),
                    List.of(String.valueOf(index)));
        }
        if (reply == -1L) {
            return PartState.NO_SUCH_JOB;
        }
        if (reply == -2L) {
            return PartState.INDEX_OUT_OF_RANGE;
        }
        return reply == 1L ? PartState.PENDING : PartState.COMPLETE;
    }

    /**
     * Pending parts are read with HMGET over consecutive index windows. Completed indexes
     * come back as nulls and are skipped, so a page can span several windows.
     */
    @Override
    public List<PendingPart> pendingParts(String jobId, int afterIndex, int limit) {
        List<PendingPart> parts = new ArrayList<>();
        try (Jedis jedis = pool.getResource()) {
            String totalField = jedis.hget(metadataKey(jobId), "total");
            if (totalField == null) {
                return parts;
            }
            int total = Integer.parseInt(totalField);

            int start = afterIndex + 1;
            while (parts.isEmpty() && start < total) {
                int end = Math.min(total, start + limit);
                String[] fields = new String[end - start];
                for (int i = start; i < end; i++) {
                    fields[i - start] = String.valueOf(i);
                }
                List<String> values = jedis.hmget(partsKey(jobId), fields);
                for (int i = 0; i < values.size(); i++) {
                    if (values.get(i) != null) {
                        parts.add(new PendingPart(start + i, values.get(i)));
                    }
                }
                start = end;
            }
        }
        return parts;
    }

    @Override
    public List<JobRef> jobIds(long afterSequence, int limit) {
        List<JobRef> refs = new ArrayList<>();
        try (Jedis jedis = pool.getResource()) {
            List<Tuple> page = jedis.zrangeByScoreWithScores(
                    JOB_INDEX_KEY, afterSequence + 1, Double.POSITIVE_INFINITY, 0, limit);
            for (Tuple tuple : page) {
                refs.add(new JobRef(tuple.getElement(), (long) tuple.getScore()));
            }
        }
        return refs;
    }

    @Override
    public boolean deleteJob(String jobId) {
        try (Jedis jedis = pool.getResource()) {
            Object reply = jedis.eval(DELETE_JOB_SCRIPT,
                    List.of(metadataKey(jobId), partsKey(jobId), JOB_INDEX_KEY),
                    List.of(jobId));
            return ((Long) reply) > 0;
        }
    }

    @Override
    public void close() {
        pool.close();
        logger.info("Redis connection pool closed");
    }
}
