package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

import java.time.Instant;

/**
 * Immutable record of one visible status change.
 */
public class TraceEvent
{

    private final Instant timestamp;

    private final int nodeId;

    private final String nodeName;

    private final String nodeIp;

    private final String groupName;

    private final NodeStatus oldStatus;

    private final NodeStatus newStatus;

    private final String reason;

    public TraceEvent(Instant timestamp, int nodeId, String nodeName, String nodeIp, String groupName,
                      NodeStatus oldStatus, NodeStatus newStatus, String reason)
    {
        this.timestamp = timestamp;

        this.nodeId = nodeId;

        this.nodeName = nodeName;

        this.nodeIp = nodeIp;

        this.groupName = groupName;

        this.oldStatus = oldStatus;

        this.newStatus = newStatus;

        this.reason = reason;
    }

    public Instant getTimestamp()
    {
        return timestamp;
    }

    public int getNodeId()
    {
        return nodeId;
    }

    public String getNodeName()
    {
        return nodeName;
    }

    public String getNodeIp()
    {
        return nodeIp;
    }

    public String getGroupName()
    {
        return groupName;
    }

    public NodeStatus getOldStatus()
    {
        return oldStatus;
    }

    public NodeStatus getNewStatus()
    {
        return newStatus;
    }

    public String getReason()
    {
        return reason;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("timestamp", timestamp.toString())
            .put("node_id", nodeId)
            .put("node_name", nodeName)
            .put("ip", nodeIp)
            .put("group_name", groupName)
            .put("old_status", oldStatus.name())
            .put("new_status", newStatus.name())
            .put("reason", reason);
    }

    @Override
    public String toString()
    {
        return nodeName + " (" + nodeIp + "): " + oldStatus + " -> " + newStatus + " [" + reason + "]";
    }
}
