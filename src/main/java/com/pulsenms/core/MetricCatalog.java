package com.pulsenms.core;

import com.pulsenms.models.MetricCategory;

import com.pulsenms.models.MetricDefinition;

import com.pulsenms.models.MetricType;

import com.pulsenms.models.OidTemplate;

import java.util.List;

/**
 * MetricCatalog - Well-known OIDs and the default metric definitions seeded into metric_definitions

 * Seeding is idempotent: existing definitions with the same name are left untouched.
 */
public class MetricCatalog
{

    // SNMPv2-MIB system group
    public static final String SYS_DESCR_OID = "1.3.6.1.2.1.1.1.0";

    public static final String SYS_OBJECT_ID_OID = "1.3.6.1.2.1.1.2.0";

    public static final String SYS_UPTIME_OID = "1.3.6.1.2.1.1.3.0";

    public static final String SYS_NAME_OID = "1.3.6.1.2.1.1.5.0";

    /**
     * Default metric definitions (ids unset).
     *
     * @return Definitions in seeding order
     */
    public static List<MetricDefinition> defaults()
    {
        return List.of(
            define("Interface Bytes In", "1.3.6.1.2.1.2.2.1.10.{index}", MetricType.COUNTER, "bytes",
                MetricCategory.INTERFACE, "ifInOctets - inbound traffic (32-bit counter)"),

            define("Interface Bytes Out", "1.3.6.1.2.1.2.2.1.16.{index}", MetricType.COUNTER, "bytes",
                MetricCategory.INTERFACE, "ifOutOctets - outbound traffic (32-bit counter)"),

            define("Interface Traffic In (HC)", "1.3.6.1.2.1.31.1.1.1.6.{index}", MetricType.COUNTER, "bytes",
                MetricCategory.INTERFACE, "ifHCInOctets - inbound traffic (64-bit counter)"),

            define("Interface Traffic Out (HC)", "1.3.6.1.2.1.31.1.1.1.10.{index}", MetricType.COUNTER, "bytes",
                MetricCategory.INTERFACE, "ifHCOutOctets - outbound traffic (64-bit counter)"),

            define("Interface Errors In", "1.3.6.1.2.1.2.2.1.14.{index}", MetricType.COUNTER, "errors",
                MetricCategory.INTERFACE, "ifInErrors"),

            define("Interface Errors Out", "1.3.6.1.2.1.2.2.1.20.{index}", MetricType.COUNTER, "errors",
                MetricCategory.INTERFACE, "ifOutErrors"),

            define("Interface Status", "1.3.6.1.2.1.2.2.1.8.{index}", MetricType.GAUGE, "status",
                MetricCategory.INTERFACE, "ifOperStatus (1 = up, 2 = down)"),

            define("CPU Utilization", "1.3.6.1.2.1.25.3.3.1.2.{index}", MetricType.GAUGE, "percent",
                MetricCategory.SYSTEM, "hrProcessorLoad per processor"),

            define("System Uptime", SYS_UPTIME_OID, MetricType.GAUGE, "ticks",
                MetricCategory.SYSTEM, "sysUpTime in hundredths of a second"),

            define("Temperature", "1.3.6.1.4.1.4413.1.1.43.1.8.1.5.1.0", MetricType.GAUGE, "celsius",
                MetricCategory.SYSTEM, "Chassis temperature (Broadcom FASTPATH)")
        );
    }

    private static MetricDefinition define(String name, String template, MetricType type, String unit,
                                           MetricCategory category, String description)
    {
        return new MetricDefinition()
            .setName(name)
            .setOidTemplate(new OidTemplate(template, category == MetricCategory.INTERFACE))
            .setType(type)
            .setUnit(unit)
            .setCategory(category)
            .setDescription(description);
    }

}
