package com.presencelite.trust;

import com.presencelite.model.TrustTier;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryTrustCircleStore implements TrustCircleStore {

    private final Map<String, TrustTier> tiers = new ConcurrentHashMap<>();

    public InMemoryTrustCircleStore() {
    }

    public InMemoryTrustCircleStore(Map<String, TrustTier> initial) {
        tiers.putAll(initial);
    }

    @Override
    public Optional<TrustTier> getTrustLevel(String peerIdentity) {
        return Optional.ofNullable(tiers.get(peerIdentity));
    }

    @Override
    public void setTrustLevel(String peerIdentity, TrustTier tier) {
        tiers.put(Objects.requireNonNull(peerIdentity, "peerIdentity"), Objects.requireNonNull(tier, "tier"));
    }

    @Override
    public boolean removeTrustLevel(String peerIdentity) {
        return tiers.remove(peerIdentity) != null;
    }

    @Override
    public Map<String, TrustTier> entries() {
        return Map.copyOf(tiers);
    }
}
