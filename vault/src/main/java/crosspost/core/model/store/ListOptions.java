package crosspost.core.model.store;

import java.util.OptionalInt;

/**
 * Options for ordered prefix scans.
 *
 * @param reverse return entries in descending key order
 * @param limit   maximum number of entries to return, empty for no limit
 */
public record ListOptions(boolean reverse, OptionalInt limit) {

    private static final ListOptions DEFAULTS = new ListOptions(false, OptionalInt.empty());

    public ListOptions {
        if (limit == null) {
            limit = OptionalInt.empty();
        }
        if (limit.isPresent() && limit.getAsInt() < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
    }

    public static ListOptions defaults() {
        return DEFAULTS;
    }

    public static ListOptions newestFirst(int limit) {
        return new ListOptions(true, OptionalInt.of(limit));
    }

    public ListOptions withLimit(int limit) {
        return new ListOptions(reverse, OptionalInt.of(limit));
    }
}
