package crosspost.core.service.store;

import crosspost.core.model.store.KeyPath;
import crosspost.core.port.out.KeyedStore;

/**
 * Logical namespaces of the credential subsystem.
 *
 * <ul>
 *   <li>{@code token/{platform}/{userId}} - encrypted credential envelopes</li>
 *   <li>{@code auth/{state}} - transient OAuth flow state</li>
 *   <li>{@code wallet-index/{walletId}} - linked accounts of a wallet</li>
 *   <li>{@code wallet-auth/{walletId}} - wallet authorization records</li>
 *   <li>{@code audit/{timestamp}} - credential access audit records</li>
 * </ul>
 */
public final class StoreNamespaces {

    public static final KeyPath TOKEN = KeyPath.of("token");
    public static final KeyPath AUTH_STATE = KeyPath.of("auth");
    public static final KeyPath WALLET_INDEX = KeyPath.of("wallet-index");
    public static final KeyPath WALLET_AUTH = KeyPath.of("wallet-auth");
    public static final KeyPath AUDIT = KeyPath.of("audit");

    private StoreNamespaces() {}

    public static NamespacedStore tokens(KeyedStore store) {
        return new NamespacedStore(store, TOKEN);
    }

    public static NamespacedStore authStates(KeyedStore store) {
        return new NamespacedStore(store, AUTH_STATE);
    }

    public static NamespacedStore walletIndex(KeyedStore store) {
        return new NamespacedStore(store, WALLET_INDEX);
    }

    public static NamespacedStore walletAuthorizations(KeyedStore store) {
        return new NamespacedStore(store, WALLET_AUTH);
    }

    public static NamespacedStore audit(KeyedStore store) {
        return new NamespacedStore(store, AUDIT);
    }
}
