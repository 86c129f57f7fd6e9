package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Outcome of merging discovery results into the inventory.
 */
public class ImportReport
{

    private final int created;

    private final int updated;

    private final int skipped;

    public ImportReport(int created, int updated, int skipped)
    {
        this.created = created;

        this.updated = updated;

        this.skipped = skipped;
    }

    public int getCreated()
    {
        return created;
    }

    public int getUpdated()
    {
        return updated;
    }

    public int getSkipped()
    {
        return skipped;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("imported", created)
            .put("updated", updated)
            .put("skipped", skipped);
    }

    @Override
    public String toString()
    {
        return "ImportReport{created=" + created + ", updated=" + updated + ", skipped=" + skipped + "}";
    }
}
