package crosspost.core.model.store;

/**
 * A key/value pair returned from a prefix scan.
 *
 * @param key   the entry key
 * @param value the stored value
 */
public record StoreEntry(KeyPath key, String value) {}
