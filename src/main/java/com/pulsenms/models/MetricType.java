package com.pulsenms.models;

/**
 * How a metric value is interpreted.
 * COUNTER values are monotonically increasing and turned into per-second rates.
 */
public enum MetricType
{

    COUNTER("counter"),

    GAUGE("gauge");

    private final String code;

    MetricType(String code)
    {
        this.code = code;
    }

    public String code()
    {
        return code;
    }

    /**
     * Resolve a stored code ("counter" / "gauge"), defaulting to GAUGE for unknown values.
     *
     * @param code Stored code
     * @return Matching metric type
     */
    public static MetricType fromCode(String code)
    {
        for (var type : values())
        {
            if (type.code.equalsIgnoreCase(code))
            {
                return type;
            }
        }

        return GAUGE;
    }
}
