package de.t14d3.skein.notification;

/**
 * Change notifications delivered to listeners of an instance.
 */
public enum Notification {
    /**
     * The instance now sees new data, either its own commit or a refresh.
     */
    DID_CHANGE,
    /**
     * Another instance committed and this one does not refresh automatically.
     */
    REFRESH_REQUIRED
}
