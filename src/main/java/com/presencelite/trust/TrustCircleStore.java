package com.presencelite.trust;

import com.presencelite.model.TrustTier;

import java.util.Map;
import java.util.Optional;

/**
 * Local record of the trust tier the user holds for each peer. Only the
 * local user writes to it.
 */
public interface TrustCircleStore {

    Optional<TrustTier> getTrustLevel(String peerIdentity);

    void setTrustLevel(String peerIdentity, TrustTier tier);

    /** Returns true when an entry was removed. */
    boolean removeTrustLevel(String peerIdentity);

    /** Snapshot of all entries. */
    Map<String, TrustTier> entries();
}
