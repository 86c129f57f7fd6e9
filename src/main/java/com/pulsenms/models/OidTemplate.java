package com.pulsenms.models;

import com.pulsenms.utils.ValidationUtil;

/**
 * OID template with an optional "{index}" placeholder, e.g. "1.3.6.1.2.1.2.2.1.10.{index}".

 * Resolution is a pure function of the template and the interface index.
 */
public class OidTemplate
{

    public static final String INDEX_PLACEHOLDER = "{index}";

    private final String template;

    private final boolean requiresIndex;

    public OidTemplate(String template, boolean requiresIndex)
    {
        if (!ValidationUtil.isValidOidTemplate(template))
        {
            throw new IllegalArgumentException("Invalid OID template: " + template);
        }

        this.template = template.trim();

        this.requiresIndex = requiresIndex || this.template.contains(INDEX_PLACEHOLDER);
    }

    /**
     * Resolve the template into a concrete OID.
     *
     * @param index Interface index, may be null for templates without a placeholder
     * @return Concrete OID
     * @throws IllegalArgumentException when an index is required but missing or negative
     */
    public String resolve(Integer index)
    {
        if (requiresIndex && index == null)
        {
            throw new IllegalArgumentException("OID template " + template + " requires an interface index");
        }

        if (index != null && index < 0)
        {
            throw new IllegalArgumentException("Interface index must not be negative: " + index);
        }

        if (!template.contains(INDEX_PLACEHOLDER))
        {
            return template;
        }

        return template.replace(INDEX_PLACEHOLDER, String.valueOf(index));
    }

    public String getTemplate()
    {
        return template;
    }

    public boolean requiresIndex()
    {
        return requiresIndex;
    }

    @Override
    public String toString()
    {
        return template;
    }
}
