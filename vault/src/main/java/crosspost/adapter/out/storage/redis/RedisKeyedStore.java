package crosspost.adapter.out.storage.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.redis.client.Response;
import org.jboss.logging.Logger;

import crosspost.core.model.store.KeyPath;
import crosspost.core.model.store.ListOptions;
import crosspost.core.model.store.StoreEntry;
import crosspost.core.port.out.KeyedStore;

/**
 * Redis-based implementation of the keyed store.
 *
 * <p>Each value is a Redis string. Redis has no ordered prefix scan over string
 * keys, so every stored key is also a member of a sorted set with score 0, which
 * Redis orders lexicographically. Prefix listings walk that set with
 * {@code ZRANGEBYLEX}/{@code ZREVRANGEBYLEX} and fetch values with {@code MGET}.
 *
 * <p>Writes that touch both the value and the index run as Lua scripts so the two
 * change together. Values written with a TTL expire through Redis and are also
 * tracked in an expiry set scored by their deadline. Every {@code set} sweeps a
 * bounded batch of overdue members out of both sets, so keys that are never
 * listed do not accumulate in the index. Listings prune any expired member they
 * still come across.
 *
 * <p>Key format:
 * <ul>
 *   <li>{@code {prefix}kv:{encodedKey}} - value</li>
 *   <li>{@code {prefix}kv-index} - sorted set of encoded keys</li>
 *   <li>{@code {prefix}kv-expiry} - encoded keys with a TTL, scored by deadline in epoch ms</li>
 * </ul>
 */
public class RedisKeyedStore implements KeyedStore {

    private static final Logger LOG = Logger.getLogger(RedisKeyedStore.class);
    private static final int SCAN_BATCH_SIZE = 100;
    static final int SWEEP_BATCH_SIZE = 20;

    /**
     * KEYS[1] value key, KEYS[2] index key, KEYS[3] expiry key; ARGV[1] value, ARGV[2] member,
     * ARGV[3] TTL in ms (0 = none), ARGV[4] value key prefix, ARGV[5] sweep batch size.
     * Returns the number of swept members.
     */
    private static final String SET_SCRIPT =
            """
            local ttl = tonumber(ARGV[3])
            local time = redis.call('TIME')
            local now = tonumber(time[1]) * 1000 + math.floor(tonumber(time[2]) / 1000)
            if ttl > 0 then
                redis.call('SET', KEYS[1], ARGV[1], 'PX', ttl)
                redis.call('ZADD', KEYS[3], now + ttl, ARGV[2])
            else
                redis.call('SET', KEYS[1], ARGV[1])
                redis.call('ZREM', KEYS[3], ARGV[2])
            end
            redis.call('ZADD', KEYS[2], 0, ARGV[2])
            local swept = 0
            local overdue = redis.call('ZRANGEBYSCORE', KEYS[3], '-inf', now, 'LIMIT', 0, tonumber(ARGV[5]))
            for _, member in ipairs(overdue) do
                if redis.call('EXISTS', ARGV[4] .. member) == 0 then
                    redis.call('ZREM', KEYS[2], member)
                    redis.call('ZREM', KEYS[3], member)
                    swept = swept + 1
                end
            end
            return swept
            """;

    /**
     * KEYS[1] value key, KEYS[2] index key, KEYS[3] expiry key; ARGV[1] member.
     */
    private static final String DELETE_SCRIPT =
            """
            redis.call('DEL', KEYS[1])
            redis.call('ZREM', KEYS[2], ARGV[1])
            redis.call('ZREM', KEYS[3], ARGV[1])
            return 1
            """;

    /**
     * KEYS[1] value key, KEYS[2] index key, KEYS[3] expiry key; ARGV[1] member.
     * Returns the removed value or nil.
     */
    private static final String GET_AND_DELETE_SCRIPT =
            """
            local value = redis.call('GET', KEYS[1])
            if value then
                redis.call('DEL', KEYS[1])
            end
            redis.call('ZREM', KEYS[2], ARGV[1])
            redis.call('ZREM', KEYS[3], ARGV[1])
            return value
            """;

    /**
     * KEYS[1] value key, KEYS[2] index key, KEYS[3] expiry key; ARGV[1] '1' if a current
     * value is expected, ARGV[2] expected value, ARGV[3] new value, ARGV[4] member.
     * Returns 1 if written. The new value has no TTL.
     */
    private static final String COMPARE_AND_SET_SCRIPT =
            """
            local current = redis.call('GET', KEYS[1])
            if ARGV[1] == '1' then
                if current ~= ARGV[2] then
                    return 0
                end
            elseif current then
                return 0
            end
            redis.call('SET', KEYS[1], ARGV[3])
            redis.call('ZADD', KEYS[2], 0, ARGV[4])
            redis.call('ZREM', KEYS[3], ARGV[4])
            return 1
            """;

    /**
     * KEYS[1] index key, KEYS[2] expiry key; ARGV[1] value key prefix, ARGV[2..n] members.
     * Removes members whose value no longer exists.
     */
    private static final String PRUNE_SCRIPT =
            """
            local removed = 0
            for i = 2, #ARGV do
                if redis.call('EXISTS', ARGV[1] .. ARGV[i]) == 0 then
                    removed = removed + redis.call('ZREM', KEYS[1], ARGV[i])
                    redis.call('ZREM', KEYS[2], ARGV[i])
                end
            end
            return removed
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final RedisTimeoutHelper timeoutHelper;
    private final String valuePrefix;
    private final String indexKey;
    private final String expiryKey;

    public RedisKeyedStore(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.timeoutHelper = timeoutHelper;
        this.valuePrefix = keyPrefix + "kv:";
        this.indexKey = keyPrefix + "kv-index";
        this.expiryKey = keyPrefix + "kv-expiry";
    }

    @Override
    public Uni<Optional<String>> get(KeyPath key) {
        final var operation = valueCommands.get(valueKey(key)).map(Optional::ofNullable);
        return timeoutHelper.withTimeout(operation, "get");
    }

    @Override
    public Uni<Void> set(KeyPath key, String value, Optional<Duration> ttl) {
        final var ttlMillis = ttl.map(Duration::toMillis).orElse(0L);
        if (ttl.isPresent() && ttlMillis <= 0) {
            return Uni.createFrom().failure(new IllegalArgumentException("ttl must be at least one millisecond"));
        }
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        SET_SCRIPT,
                        "3", // numkeys
                        valueKey(key), // KEYS[1]
                        indexKey, // KEYS[2]
                        expiryKey, // KEYS[3]
                        value, // ARGV[1]
                        key.encoded(), // ARGV[2]
                        String.valueOf(ttlMillis), // ARGV[3]
                        valuePrefix, // ARGV[4]
                        String.valueOf(SWEEP_BATCH_SIZE) // ARGV[5]
                        )
                .invoke(swept -> {
                    if (swept != null && swept.toLong() > 0) {
                        LOG.debugf("Swept %d expired index entries", swept.toLong());
                    }
                })
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "set");
    }

    @Override
    public Uni<Void> delete(KeyPath key) {
        final var operation = redisDataSource
                .execute("EVAL", DELETE_SCRIPT, "3", valueKey(key), indexKey, expiryKey, key.encoded())
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "delete");
    }

    @Override
    public Uni<Optional<String>> getAndDelete(KeyPath key) {
        final var operation = redisDataSource
                .execute("EVAL", GET_AND_DELETE_SCRIPT, "3", valueKey(key), indexKey, expiryKey, key.encoded())
                .map(response -> response == null ? Optional.<String>empty() : Optional.of(response.toString()));
        return timeoutHelper.withTimeout(operation, "getAndDelete");
    }

    @Override
    public Uni<Boolean> compareAndSet(KeyPath key, Optional<String> expected, String newValue) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        COMPARE_AND_SET_SCRIPT,
                        "3", // numkeys
                        valueKey(key), // KEYS[1]
                        indexKey, // KEYS[2]
                        expiryKey, // KEYS[3]
                        expected.isPresent() ? "1" : "0", // ARGV[1]
                        expected.orElse(""), // ARGV[2]
                        newValue, // ARGV[3]
                        key.encoded() // ARGV[4]
                        )
                .map(response -> response != null && response.toLong() == 1L);
        return timeoutHelper.withTimeout(operation, "compareAndSet");
    }

    @Override
    public Uni<List<StoreEntry>> list(KeyPath prefix, ListOptions options) {
        final var limit = options.limit().orElse(Integer.MAX_VALUE);
        if (limit == 0) {
            return Uni.createFrom().item(List.of());
        }
        final var operation = scanPage(prefix.encodedPrefix(), options.reverse(), limit, 0, new ArrayList<>());
        return timeoutHelper.withTimeout(operation, "list");
    }

    /**
     * Walks the index one batch at a time until {@code limit} live entries are found
     * or the range is exhausted.
     */
    private Uni<List<StoreEntry>> scanPage(
            String encodedPrefix, boolean reverse, int limit, int offset, List<StoreEntry> collected) {
        final var min = encodedPrefix.isEmpty() ? "-" : "[" + encodedPrefix;
        final var max = encodedPrefix.isEmpty() ? "+" : "(" + upperBound(encodedPrefix);
        final Uni<Response> range = reverse
                ? redisDataSource.execute(
                        "ZREVRANGEBYLEX",
                        indexKey,
                        max,
                        min,
                        "LIMIT",
                        String.valueOf(offset),
                        String.valueOf(SCAN_BATCH_SIZE))
                : redisDataSource.execute(
                        "ZRANGEBYLEX",
                        indexKey,
                        min,
                        max,
                        "LIMIT",
                        String.valueOf(offset),
                        String.valueOf(SCAN_BATCH_SIZE));

        return range.flatMap(response -> {
            final var members = toStrings(response);
            if (members.isEmpty()) {
                return Uni.createFrom().item(List.copyOf(collected));
            }
            return fetchValues(members).flatMap(values -> {
                final var missing = new ArrayList<String>();
                for (int i = 0; i < members.size(); i++) {
                    final var value = values.get(i);
                    if (value == null) {
                        missing.add(members.get(i));
                    } else if (collected.size() < limit) {
                        collected.add(new StoreEntry(KeyPath.decode(members.get(i)), value));
                    }
                }

                final var exhausted = members.size() < SCAN_BATCH_SIZE;
                final var done = collected.size() >= limit || exhausted;
                return pruneIndex(missing).flatMap(removed -> {
                    if (done) {
                        return Uni.createFrom().item(List.copyOf(collected));
                    }
                    // Pruned members shift the remaining range towards the start
                    return scanPage(encodedPrefix, reverse, limit, offset + members.size() - removed, collected);
                });
            });
        });
    }

    private Uni<List<String>> fetchValues(List<String> members) {
        final var args = new String[members.size()];
        for (int i = 0; i < members.size(); i++) {
            args[i] = valuePrefix + members.get(i);
        }
        return redisDataSource.execute("MGET", args).map(response -> {
            final var values = new ArrayList<String>(members.size());
            for (int i = 0; i < members.size(); i++) {
                final var item = response.get(i);
                values.add(item == null ? null : item.toString());
            }
            return values;
        });
    }

    /**
     * Remove index members whose values have expired.
     *
     * @return the number of members removed; 0 if pruning failed
     */
    private Uni<Integer> pruneIndex(List<String> members) {
        if (members.isEmpty()) {
            return Uni.createFrom().item(0);
        }
        final var args = new ArrayList<String>(members.size() + 5);
        args.add(PRUNE_SCRIPT);
        args.add("2"); // numkeys
        args.add(indexKey); // KEYS[1]
        args.add(expiryKey); // KEYS[2]
        args.add(valuePrefix); // ARGV[1]
        args.addAll(members); // ARGV[2..n]
        final var prune = redisDataSource
                .execute("EVAL", args.toArray(new String[0]))
                .map(response -> response == null ? 0 : response.toInteger());
        return timeoutHelper
                .withTimeoutFallback(prune, "pruneIndex", () -> 0)
                .invoke(removed -> LOG.debugf("Pruned %d expired index entries", removed));
    }

    private static List<String> toStrings(Response response) {
        final var result = new ArrayList<String>();
        if (response == null) {
            return result;
        }
        for (var i = 0; i < response.size(); i++) {
            result.add(response.get(i).toString());
        }
        return result;
    }

    private static String upperBound(String prefix) {
        final var last = prefix.charAt(prefix.length() - 1);
        return prefix.substring(0, prefix.length() - 1) + (char) (last + 1);
    }

    private String valueKey(KeyPath key) {
        return valuePrefix + key.encoded();
    }
}
