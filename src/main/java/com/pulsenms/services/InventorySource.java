package com.pulsenms.services;

import com.pulsenms.models.Inventory;

import io.vertx.core.Future;

/**
 * InventorySource - Read access to the monitoring configuration

 * Change notification: writers publish on the "inventory.changed" event bus address;
 * the monitoring verticle also re-reads periodically.
 */
public interface InventorySource
{

    String CHANGED_ADDRESS = "inventory.changed";

    /**
     * Load groups, nodes, metric definitions and node metric bindings.
     *
     * @return Future containing the raw (unvalidated) inventory
     */
    Future<Inventory> inventoryLoad();

}
