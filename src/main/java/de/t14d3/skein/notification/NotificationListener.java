package de.t14d3.skein.notification;

import de.t14d3.skein.core.Skein;

@FunctionalInterface
public interface NotificationListener {

    void onNotification(Notification notification, Skein skein);
}
