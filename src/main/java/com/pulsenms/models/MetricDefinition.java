package com.pulsenms.models;

import io.vertx.core.json.JsonObject;

/**
 * Catalog entry describing what to collect and how to interpret it.

 * Data Source: metric_definitions table (seeded from MetricCatalog)
 */
public class MetricDefinition
{

    private int id;

    private String name;

    private OidTemplate oidTemplate;

    private MetricType type = MetricType.GAUGE;

    private String unit;

    private MetricCategory category = MetricCategory.SYSTEM;

    private String source = "snmp";

    private String description;

    /**
     * Interface metrics and templates with a placeholder cannot be collected without an index.
     *
     * @return true when bindings must carry an interface index
     */
    public boolean needsIndex()
    {
        return category == MetricCategory.INTERFACE || (oidTemplate != null && oidTemplate.requiresIndex());
    }

    public boolean isCounter()
    {
        return type == MetricType.COUNTER;
    }

    public int getId()
    {
        return id;
    }

    public MetricDefinition setId(int id)
    {
        this.id = id;

        return this;
    }

    public String getName()
    {
        return name;
    }

    public MetricDefinition setName(String name)
    {
        this.name = name;

        return this;
    }

    public OidTemplate getOidTemplate()
    {
        return oidTemplate;
    }

    public MetricDefinition setOidTemplate(OidTemplate oidTemplate)
    {
        this.oidTemplate = oidTemplate;

        return this;
    }

    public MetricType getType()
    {
        return type;
    }

    public MetricDefinition setType(MetricType type)
    {
        this.type = type;

        return this;
    }

    public String getUnit()
    {
        return unit;
    }

    public MetricDefinition setUnit(String unit)
    {
        this.unit = unit;

        return this;
    }

    public MetricCategory getCategory()
    {
        return category;
    }

    public MetricDefinition setCategory(MetricCategory category)
    {
        this.category = category;

        return this;
    }

    public String getSource()
    {
        return source;
    }

    public MetricDefinition setSource(String source)
    {
        this.source = source;

        return this;
    }

    public String getDescription()
    {
        return description;
    }

    public MetricDefinition setDescription(String description)
    {
        this.description = description;

        return this;
    }

    public JsonObject toJson()
    {
        return new JsonObject()
            .put("id", id)
            .put("name", name)
            .put("oid_template", oidTemplate != null ? oidTemplate.getTemplate() : null)
            .put("metric_type", type.code())
            .put("unit", unit)
            .put("category", category.code())
            .put("requires_index", oidTemplate != null && oidTemplate.requiresIndex())
            .put("source", source)
            .put("description", description);
    }
}
