package com.pulsenms.models;

/**
 * Reachability status of a node

 * State Machine:
 * WAITING → UP (first check succeeded)
 *         → PENDING (failure, retries left) → DOWN (failure count reached max retries)
 * any     → PAUSED (node or group disabled)

 * WAITING is only shown until the first check completes.
 */
public enum NodeStatus
{

    WAITING,        // No check completed yet

    PENDING,        // Failing, still retrying

    UP,             // Last check succeeded

    DOWN,           // Failed max retries times in a row

    PAUSED          // Node or group disabled

}
