package com.pulsenms.core;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.SnmpResult;

/**
 * ProtocolProbe - Reachability and SNMP primitives used by monitoring and discovery

 * Transient network failures are returned as outcomes, never thrown.
 * A missing probe capability (e.g. the ping executable is not installed) is reported
 * with ProbeUnavailableException so callers can tell it apart from an unreachable host.

 * WARNING: Both methods are BLOCKING and must be called from a worker thread.
 */
public interface ProtocolProbe
{

    /**
     * Send ICMP echo requests.
     *
     * @param ip Target address
     * @param timeoutMs Per-packet timeout in milliseconds
     * @param count Number of packets
     * @return Outcome with average latency and packet loss
     * @throws ProbeUnavailableException when ICMP probing is not possible on this host
     */
    PingResult ping(String ip, int timeoutMs, int count);

    /**
     * Perform one SNMP v2c GET.
     *
     * @param ip Target address
     * @param port UDP port
     * @param community Community string
     * @param oid Concrete OID
     * @param timeoutMs Timeout in milliseconds
     * @return Outcome with the value rendered as text
     * @throws ProbeUnavailableException when the SNMP transport cannot be opened
     */
    SnmpResult snmpGet(String ip, int port, String community, String oid, int timeoutMs);

}
