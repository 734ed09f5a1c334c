package crosspost.spi;

import io.smallrye.mutiny.Uni;

import crosspost.core.model.identity.WalletAuthProof;

/**
 * SPI for verifying wallet signatures.
 *
 * <p>The signature scheme belongs to the wallet's chain and is supplied by the
 * deployment. Without an implementation every wallet proof is rejected.
 */
public interface SignatureVerifier {

    /**
     * Verify that the proof's signature was made over its message with its public key,
     * and that the public key belongs to the claimed account.
     *
     * @param proof the parsed proof
     * @return true if the signature is valid
     */
    Uni<Boolean> verify(WalletAuthProof proof);
}
