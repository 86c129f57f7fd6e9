package com.pulsenms.utils;

import java.util.regex.Pattern;

/**
 * ValidationUtil - Field validation shared by the inventory loader and discovery import

 * All methods return true if validation passes, false otherwise.
 */
public class ValidationUtil
{

    // Dotted numeric OID, components may be "{index}" placeholders
    private static final Pattern OID_TEMPLATE_PATTERN = Pattern.compile(
        "^(\\d+|\\{index\\})(\\.(\\d+|\\{index\\}))*$"
    );

    private static final Pattern OID_PATTERN = Pattern.compile("^\\d+(\\.\\d+)*$");

    public static boolean isValidIp(String ip)
    {
        return IPRangeUtil.isValidSingleIP(ip);
    }

    /**
     * Validate a concrete OID such as "1.3.6.1.2.1.1.3.0".
     *
     * @param oid OID string
     * @return true if valid
     */
    public static boolean isValidOid(String oid)
    {
        return oid != null && OID_PATTERN.matcher(oid.trim()).matches();
    }

    /**
     * Validate an OID template. The placeholder may appear at most once.
     *
     * @param template OID template such as "1.3.6.1.2.1.2.2.1.10.{index}"
     * @return true if valid
     */
    public static boolean isValidOidTemplate(String template)
    {
        if (template == null || !OID_TEMPLATE_PATTERN.matcher(template.trim()).matches())
        {
            return false;
        }

        return template.indexOf("{index}") == template.lastIndexOf("{index}");
    }

    /**
     * Validate port range (database CHECK constraint: port BETWEEN 1 AND 65535)
     *
     * @param port Port number to validate
     * @return true if valid or absent
     */
    public static boolean isValidPort(Integer port)
    {
        return port == null || (port >= 1 && port <= 65535);
    }

    /**
     * Validate an SNMP community string (1 to 255 characters).
     *
     * @param community Community, null means inherit
     * @return true if valid or absent
     */
    public static boolean isValidCommunity(String community)
    {
        return community == null || (!community.isEmpty() && community.length() <= 255);
    }

    /**
     * Validate a notification priority (-2 to 2).
     *
     * @param priority Priority, null means default
     * @return true if valid or absent
     */
    public static boolean isValidPriority(Integer priority)
    {
        return priority == null || (priority >= -2 && priority <= 2);
    }

    /**
     * Validate a positive interval.
     *
     * @param seconds Interval, null means inherit
     * @return true if valid or absent
     */
    public static boolean isValidInterval(Integer seconds)
    {
        return seconds == null || seconds >= 1;
    }

}
