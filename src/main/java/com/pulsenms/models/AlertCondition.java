package com.pulsenms.models;

/**
 * Direction of a threshold comparison.
 */
public enum AlertCondition
{

    GREATER_THAN("gt"),     // breach when value >= threshold

    LESS_THAN("lt");        // breach when value <= threshold

    private final String code;

    AlertCondition(String code)
    {
        this.code = code;
    }

    public String code()
    {
        return code;
    }

    /**
     * Resolve a stored condition code.
     *
     * @param code "gt" or "lt", may be null
     * @return Matching condition, or null when no condition is configured
     */
    public static AlertCondition fromCode(String code)
    {
        if (code == null)
        {
            return null;
        }

        for (var condition : values())
        {
            if (condition.code.equalsIgnoreCase(code.trim()))
            {
                return condition;
            }
        }

        return null;
    }
}
