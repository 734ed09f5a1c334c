package crosspost.core.model.store;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Hierarchical key for the keyed store.
 *
 * <p>A key is an ordered list of non-empty segments. The encoded form joins the
 * segments with {@code /} after escaping {@code %} and {@code /} inside each
 * segment. Keys are ordered by their encoded form, which is also the order storage
 * backends scan in, and a prefix match on {@link #encodedPrefix()} never crosses a
 * segment boundary.
 *
 * @param segments key segments, outermost first
 */
public record KeyPath(List<String> segments) implements Comparable<KeyPath> {

    public static final char SEPARATOR = '/';

    private static final KeyPath ROOT = new KeyPath(List.of());

    public KeyPath {
        if (segments == null) {
            throw new IllegalArgumentException("segments must not be null");
        }
        for (String segment : segments) {
            if (segment == null || segment.isEmpty()) {
                throw new IllegalArgumentException("key segments must not be null or empty");
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Create a key from the given segments.
     *
     * @param segments key segments
     * @return the key
     */
    public static KeyPath of(String... segments) {
        return new KeyPath(Arrays.asList(segments));
    }

    /**
     * The empty key, used as the prefix that matches everything.
     */
    public static KeyPath root() {
        return ROOT;
    }

    /**
     * Parse an encoded key back into its segments.
     *
     * @param encoded encoded key as produced by {@link #encoded()}
     * @return the decoded key
     */
    public static KeyPath decode(String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            return ROOT;
        }
        final var parts = encoded.split(String.valueOf(SEPARATOR), -1);
        final var decoded = new ArrayList<String>(parts.length);
        for (String part : parts) {
            decoded.add(unescape(part));
        }
        return new KeyPath(decoded);
    }

    /**
     * Return a new key with the given segments appended.
     */
    public KeyPath append(String... more) {
        final var combined = new ArrayList<String>(segments.size() + more.length);
        combined.addAll(segments);
        combined.addAll(Arrays.asList(more));
        return new KeyPath(combined);
    }

    /**
     * Return a new key with all segments of {@code other} appended.
     */
    public KeyPath append(KeyPath other) {
        final var combined = new ArrayList<String>(segments.size() + other.segments.size());
        combined.addAll(segments);
        combined.addAll(other.segments);
        return new KeyPath(combined);
    }

    /**
     * Check whether this key lies under {@code prefix}. Every key starts with the root key.
     */
    public boolean startsWith(KeyPath prefix) {
        if (prefix.segments.size() > segments.size()) {
            return false;
        }
        return segments.subList(0, prefix.segments.size()).equals(prefix.segments);
    }

    /**
     * Strip {@code prefix} from the front of this key.
     *
     * @throws IllegalArgumentException if this key does not start with the prefix
     */
    public KeyPath relativeTo(KeyPath prefix) {
        if (!startsWith(prefix)) {
            throw new IllegalArgumentException("Key " + encoded() + " is not under " + prefix.encoded());
        }
        return new KeyPath(segments.subList(prefix.segments.size(), segments.size()));
    }

    public boolean isRoot() {
        return segments.isEmpty();
    }

    /**
     * Return the last segment of the key.
     */
    public String last() {
        if (segments.isEmpty()) {
            throw new IllegalStateException("root key has no segments");
        }
        return segments.get(segments.size() - 1);
    }

    /**
     * Encoded representation used by storage backends and for ordering.
     */
    public String encoded() {
        final var sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                sb.append(SEPARATOR);
            }
            sb.append(escape(segments.get(i)));
        }
        return sb.toString();
    }

    /**
     * Encoded form of this key used as a scan prefix. Non-root prefixes end with the
     * separator so that {@code token/a} does not match {@code token/ab}.
     */
    public String encodedPrefix() {
        return isRoot() ? "" : encoded() + SEPARATOR;
    }

    @Override
    public int compareTo(KeyPath other) {
        return encoded().compareTo(other.encoded());
    }

    @Override
    public String toString() {
        return encoded();
    }

    private static String escape(String segment) {
        return segment.replace("%", "%25").replace("/", "%2F");
    }

    private static String unescape(String segment) {
        return segment.replace("%2F", "/").replace("%25", "%");
    }
}
