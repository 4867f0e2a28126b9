package org.royalewatch.event;

@FunctionalInterface
public interface MonitorEventListener {

    void onEvent(MonitorEvent event);
}
