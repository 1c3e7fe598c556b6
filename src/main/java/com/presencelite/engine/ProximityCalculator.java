package com.presencelite.engine;

import com.presencelite.geo.GeoMath;
import com.presencelite.model.LocationFix;
import com.presencelite.model.ProximityCategory;
import com.presencelite.model.ProximityInfo;
import com.presencelite.model.ViewableLocation;

/**
 * Distance from the local fix to a peer's cell centre. The peer side is only
 * ever a decoded cell, so the result is as coarse as the cell the viewer may see.
 */
public final class ProximityCalculator {

    private ProximityCalculator() {
    }

    /**
     * @return {@link ProximityInfo#unknown()} when there is no local fix, null
     *         when the peer has no visible location
     */
    public static ProximityInfo compute(LocationFix self, ViewableLocation peer) {
        if (peer == null) {
            return null;
        }
        if (self == null) {
            return ProximityInfo.unknown();
        }
        var coords = self.coordinates();
        double meters = GeoMath.haversineMeters(
            coords.latitude(), coords.longitude(),
            peer.center().latitude(), peer.center().longitude());
        return new ProximityInfo(
            ProximityCategory.forDistance(meters),
            false,
            meters,
            meters < peer.uncertaintyRadiusMeters() * 2);
    }
}
