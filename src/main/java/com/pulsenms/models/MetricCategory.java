package com.pulsenms.models;

/**
 * Metric category. INTERFACE metrics are always bound to an interface index.
 */
public enum MetricCategory
{

    INTERFACE("interface"),

    SYSTEM("system");

    private final String code;

    MetricCategory(String code)
    {
        this.code = code;
    }

    public String code()
    {
        return code;
    }

    public static MetricCategory fromCode(String code)
    {
        return INTERFACE.code.equalsIgnoreCase(code) ? INTERFACE : SYSTEM;
    }
}
