package com.presencelite.projection;

import com.presencelite.model.PresenceStatus;
import com.presencelite.model.PresenceView;

import java.util.Collection;
import java.util.List;

public final class IndicatorProjector {

    private IndicatorProjector() {
    }

    /** One indicator per view that has a visible location, in view order. */
    public static List<PresenceIndicator> toIndicators(Collection<PresenceView> views) {
        return views.stream()
            .filter(view -> view.location() != null)
            .map(IndicatorProjector::toIndicator)
            .toList();
    }

    static PresenceIndicator toIndicator(PresenceView view) {
        var location = view.location();
        return new PresenceIndicator(
            view.peerIdentity(),
            view.displayName(),
            view.color(),
            location.center(),
            location.uncertaintyRadiusMeters(),
            location.moving(),
            location.heading(),
            view.status(),
            view.trustTier(),
            view.verified(),
            view.lastSeen(),
            opacityFor(view.status()));
    }

    static double opacityFor(PresenceStatus status) {
        if (status == PresenceStatus.ONLINE) return 1.0;
        if (status == PresenceStatus.AWAY) return 0.7;
        return 0.4;
    }
}
