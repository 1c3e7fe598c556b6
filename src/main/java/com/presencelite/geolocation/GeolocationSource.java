package com.presencelite.geolocation;

import java.util.function.Consumer;

/**
 * Platform position provider. Callbacks may arrive on any thread.
 */
public interface GeolocationSource {

    /**
     * Starts delivering fixes until {@link #clearWatch} is called. Errors after
     * the watch started go to {@code onError}.
     *
     * @throws GeolocationException when the watch cannot be started
     */
    WatchHandle watch(Consumer<GeoFix> onFix, Consumer<LocationError> onError) throws GeolocationException;

    /** Stops a watch. Unknown or already cleared handles are ignored. */
    void clearWatch(WatchHandle handle);

    /** Delivers exactly one fix or one error. */
    void getCurrentFix(Consumer<GeoFix> onFix, Consumer<LocationError> onError);
}
