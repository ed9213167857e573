package feed.relay.action;

import cn.hutool.cache.CacheUtil;
import cn.hutool.cache.impl.LRUCache;
import cn.hutool.core.util.RandomUtil;
import cn.hutool.core.util.StrUtil;
import cn.hutool.log.Log;
import cn.hutool.log.LogFactory;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Short-lived tokens standing in for a list of item ids behind an action button.
 * Tokens live in memory only and are lost on restart. The registry is bounded: a token expires after its
 * time to live, and once the capacity is reached binding a new token drops the least recently used one.
 */
public class ReferenceTokenRegistry {

    private static final Log log = LogFactory.get();

    private static final String TOKEN_ALPHABET = RandomUtil.BASE_CHAR + RandomUtil.BASE_NUMBER;

    public static final int DEFAULT_CAPACITY = 10_000;

    public static final long DEFAULT_TTL_MS = 86_400_000L;

    private final LRUCache<String, List<String>> tokens;

    private final Set<String> prefixes;

    private final int suffixLength;

    public ReferenceTokenRegistry(int suffixLength) {
        this(suffixLength, DEFAULT_CAPACITY, DEFAULT_TTL_MS);
    }

    public ReferenceTokenRegistry(int suffixLength, int capacity, long ttlMs) {
        this(Arrays.stream(ActionKind.values())
                .map(ActionKind::tokenPrefix)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet()), suffixLength, capacity, ttlMs);
    }

    public ReferenceTokenRegistry(Set<String> prefixes, int suffixLength, int capacity, long ttlMs) {
        this.prefixes = Set.copyOf(prefixes);
        this.suffixLength = suffixLength;
        this.tokens = CacheUtil.newLRUCache(capacity, ttlMs);
    }

    /**
     * A fresh token such as {@code hd_k3x9q2}. Nothing is stored until {@link #bind}.
     */
    public String allocate(String prefix) {
        return prefix + "_" + RandomUtil.randomString(TOKEN_ALPHABET, suffixLength);
    }

    /**
     * Bind a token to item ids; an existing binding is overwritten.
     */
    public synchronized void bind(String token, List<String> itemIds) {
        List<String> previous = tokens.get(token, false);
        if (previous != null) {
            log.debug("Token {} rebound, {} item(s) replaced", token, previous.size());
        }
        tokens.put(token, List.copyOf(itemIds));
    }

    public String register(ActionKind kind, List<String> itemIds) {
        String token = allocate(kind.tokenPrefix());
        bind(token, itemIds);
        return token;
    }

    public synchronized Optional<List<String>> resolve(String token) {
        return Optional.ofNullable(tokens.get(token, false));
    }

    /**
     * Resolve and remove in one step; of two concurrent callers only one gets the ids.
     */
    public synchronized Optional<List<String>> consumeOnce(String token) {
        List<String> itemIds = tokens.get(token, false);
        if (itemIds != null) {
            tokens.remove(token);
        }
        return Optional.ofNullable(itemIds);
    }

    /**
     * Whether the token has the shape of a registry token, bound or not.
     * Anything else is a raw item id used directly as token.
     */
    public boolean isRegistryToken(String token) {
        if (StrUtil.isBlank(token)) {
            return false;
        }
        int separator = token.lastIndexOf('_');
        if (separator <= 0) {
            return false;
        }
        String suffix = token.substring(separator + 1);
        return prefixes.contains(token.substring(0, separator))
                && suffix.length() == suffixLength
                && StrUtil.containsOnly(suffix, TOKEN_ALPHABET.toCharArray());
    }

    /**
     * Bound tokens, expired ones excluded.
     */
    public synchronized int size() {
        tokens.prune();
        return tokens.size();
    }
}
