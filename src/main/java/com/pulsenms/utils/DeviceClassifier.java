package com.pulsenms.utils;

import java.util.Locale;

/**
 * Guesses vendor and device type from an SNMP sysDescr string.
 */
public class DeviceClassifier
{

    public static final String UNKNOWN_VENDOR = "Unknown";

    public static final String DEFAULT_TYPE = "Device";

    /**
     * Vendor guess. First matching rule wins.
     *
     * @param sysDescr sysDescr value, may be null
     * @return Vendor name or "Unknown"
     */
    public static String guessVendor(String sysDescr)
    {
        if (sysDescr == null || sysDescr.isBlank())
        {
            return UNKNOWN_VENDOR;
        }

        var descr = sysDescr.toLowerCase(Locale.ROOT);

        if (descr.contains("synology"))
        {
            return "Synology";
        }

        if (descr.contains("ubiquiti") || descr.contains("unifi") || descr.contains("edgeos"))
        {
            return "Ubiquiti";
        }

        if (descr.contains("cisco"))
        {
            return "Cisco";
        }

        if (descr.contains("mikrotik") || descr.contains("routeros"))
        {
            return "MikroTik";
        }

        if (descr.contains("procurve") || descr.contains("hewlett") || descr.contains("hp "))
        {
            return "HP";
        }

        if (descr.contains("windows"))
        {
            return "Microsoft";
        }

        if (descr.contains("linux"))
        {
            return "Linux";
        }

        return UNKNOWN_VENDOR;
    }

    /**
     * Device type guess. First matching rule wins.
     *
     * @param sysDescr sysDescr value, may be null
     * @return Device type or "Device"
     */
    public static String guessType(String sysDescr)
    {
        if (sysDescr == null || sysDescr.isBlank())
        {
            return DEFAULT_TYPE;
        }

        var descr = sysDescr.toLowerCase(Locale.ROOT);

        if (descr.contains("synology") || descr.contains("nas"))
        {
            return "NAS";
        }

        if (descr.contains("uap") || descr.contains("access point") || descr.contains("unifi"))
        {
            return "Access Point";
        }

        if (descr.contains("printer") || descr.contains("jetdirect"))
        {
            return "Printer";
        }

        if (descr.contains("switch") || descr.contains("procurve") || descr.contains("catalyst"))
        {
            return "Switch";
        }

        if (descr.contains("router") || descr.contains("routeros") || descr.contains("edgeos"))
        {
            return "Router";
        }

        if (descr.contains("linux") || descr.contains("windows"))
        {
            return "Server";
        }

        return DEFAULT_TYPE;
    }

}
