package sensormonitor.store;

import sensormonitor.domain.DeviceSnapshot;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only view of the device state used by polling consumers.
 * Every call returns copies; nothing handed out here changes afterwards.
 */
public interface SnapshotReader {

    /**
     * Copy of one device's current state.
     *
     * @param deviceId the device id
     * @return the snapshot, or empty if the device has never been seen
     */
    Optional<DeviceSnapshot> snapshot(String deviceId);

    /**
     * Device ids known at the moment of the call. May be stale once consumed.
     */
    Set<String> listDeviceIds();

    /**
     * Number of known devices.
     */
    default int deviceCount() {
        return listDeviceIds().size();
    }

    /**
     * Snapshot every known device, ordered by device id.
     * <p>
     * Each device is copied independently, so the result can mix slightly different
     * points in time across devices. It is not a single cross-device transaction.
     */
    default Map<String, DeviceSnapshot> snapshotAll() {
        Map<String, DeviceSnapshot> snapshots = new TreeMap<>();
        for (String deviceId : listDeviceIds()) {
            snapshot(deviceId).ifPresent(s -> snapshots.put(deviceId, s));
        }
        return Collections.unmodifiableMap(snapshots);
    }
}
