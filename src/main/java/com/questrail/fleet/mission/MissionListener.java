package com.questrail.fleet.mission;

/**
 * Notified whenever a mission order is recorded or changes acknowledgement
 * state. This is how TIMEOUT and FAILED reach the operator.
 */
@FunctionalInterface
public interface MissionListener
{
    void onMissionUpdate(MissionOrder order);
}
