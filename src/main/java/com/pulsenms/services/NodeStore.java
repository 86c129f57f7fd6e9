package com.pulsenms.services;

import com.pulsenms.models.Node;

import io.vertx.core.Future;

/**
 * NodeStore - Node writes used by discovery import
 */
public interface NodeStore
{

    /**
     * Create a node.
     *
     * @param node Node without id
     * @return Future containing the stored node with its id
     */
    Future<Node> nodeCreate(Node node);

    /**
     * Apply what a discovery scan confirmed to an existing node. Only the monitoring flags
     * and the SNMP community are written: a non-null monitorPing or monitorSnmp replaces the
     * stored flag, a non-null community fills the stored one only when it is unset. Every
     * other column keeps its stored value.
     *
     * @param patch Node id plus the fields to merge
     * @return Future containing the patch, failed when the node no longer exists
     */
    Future<Node> nodeMergeDiscovery(Node patch);

}
