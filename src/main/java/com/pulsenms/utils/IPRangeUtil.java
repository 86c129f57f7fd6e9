package com.pulsenms.utils;

import java.util.ArrayList;

import java.util.List;

import java.util.regex.Pattern;

/**
 * IPRangeUtil - Utility class for parsing and expanding discovery targets

 * This utility supports:
 * - Single IP addresses: "192.168.1.100"
 * - CIDR blocks: "192.168.1.0/24" (usable hosts only, network and broadcast excluded)
 * - IP ranges in same subnet: "192.168.1.1-50" (expands to 192.168.1.1 through 192.168.1.50)

 * - IPv4 only
 */
public class IPRangeUtil
{

    // Largest block a single scan may cover (/16)
    public static final int MIN_PREFIX_LENGTH = 16;

    private static final String OCTET = "(25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)";

    private static final Pattern SINGLE_IP_PATTERN = Pattern.compile(
        "^(" + OCTET + "\\.){3}" + OCTET + "$"
    );

    private static final Pattern IP_RANGE_PATTERN = Pattern.compile(
        "^(" + OCTET + "\\.){3}" + OCTET + "-" + OCTET + "$"
    );

    private static final Pattern CIDR_PATTERN = Pattern.compile(
        "^(" + OCTET + "\\.){3}" + OCTET + "/([0-9]|[12][0-9]|3[0-2])$"
    );

    /**
     * Expand a discovery target into the individual addresses to probe.
     *
     * @param target CIDR block, range or single address
     * @return Addresses in ascending order
     * @throws IllegalArgumentException if the format is invalid or the block is too large
     */
    public static List<String> expandTarget(String target)
    {
        if (target == null || target.trim().isEmpty())
        {
            throw new IllegalArgumentException("Target cannot be null or empty");
        }

        var trimmed = target.trim();

        if (CIDR_PATTERN.matcher(trimmed).matches())
        {
            return expandCidr(trimmed);
        }

        if (trimmed.contains("-"))
        {
            if (!isValidIPRange(trimmed))
            {
                throw new IllegalArgumentException("Invalid IP range format: " + trimmed +
                    ". Expected format: '192.168.1.1-50'");
            }

            return expandIPRange(trimmed);
        }

        if (!isValidSingleIP(trimmed))
        {
            throw new IllegalArgumentException("Invalid target: " + trimmed +
                ". Expected CIDR ('192.168.1.0/24'), range ('192.168.1.1-50') or single IP");
        }

        return List.of(trimmed);
    }

    /**
     * Validate if a string is a valid single IP address
     *
     * @param ip The IP address string to validate
     * @return true if valid, false otherwise
     */
    public static boolean isValidSingleIP(String ip)
    {
        if (ip == null || ip.trim().isEmpty())
        {
            return false;
        }

        return SINGLE_IP_PATTERN.matcher(ip.trim()).matches();
    }

    /**
     * Validate if a string is a valid IP range format
     *
     * @param ipRange The IP range string to validate (e.g., "192.168.1.1-50")
     * @return true if valid, false otherwise
     */
    public static boolean isValidIPRange(String ipRange)
    {
        if (ipRange == null || !IP_RANGE_PATTERN.matcher(ipRange.trim()).matches())
        {
            return false;
        }

        var parts = ipRange.trim().split("-");

        var startOctet = Integer.parseInt(parts[0].split("\\.")[3]);

        var endOctet = Integer.parseInt(parts[1]);

        return startOctet <= endOctet;
    }

    /**
     * Convert a dotted quad into its unsigned 32-bit value.
     *
     * @param ip Valid IPv4 address
     * @return Address as long
     */
    public static long toLong(String ip)
    {
        var value = 0L;

        for (var part : ip.split("\\."))
        {
            value = (value << 8) | Integer.parseInt(part);
        }

        return value;
    }

    /**
     * Convert an unsigned 32-bit value into a dotted quad.
     *
     * @param value Address as long
     * @return IPv4 address
     */
    public static String fromLong(long value)
    {
        return ((value >> 24) & 0xFF) + "." + ((value >> 16) & 0xFF) + "." + ((value >> 8) & 0xFF) + "." + (value & 0xFF);
    }

    private static List<String> expandCidr(String cidr)
    {
        var parts = cidr.split("/");

        var prefix = Integer.parseInt(parts[1]);

        if (prefix < MIN_PREFIX_LENGTH)
        {
            throw new IllegalArgumentException("CIDR block too large: " + cidr + ". Minimum prefix length is /" + MIN_PREFIX_LENGTH);
        }

        var size = 1L << (32 - prefix);

        var mask = 0xFFFFFFFFL ^ (size - 1);

        var network = toLong(parts[0]) & mask;

        var first = network;

        var last = network + size - 1;

        // /31 and /32 have no network or broadcast address to skip
        if (prefix <= 30)
        {
            first++;

            last--;
        }

        var ipList = new ArrayList<String>((int) (last - first + 1));

        for (var address = first; address <= last; address++)
        {
            ipList.add(fromLong(address));
        }

        return ipList;
    }

    private static List<String> expandIPRange(String ipRange)
    {
        var ipList = new ArrayList<String>();

        var parts = ipRange.split("-");

        var ipParts = parts[0].split("\\.");

        var ipBase = ipParts[0] + "." + ipParts[1] + "." + ipParts[2] + ".";

        var startOctet = Integer.parseInt(ipParts[3]);

        var endOctet = Integer.parseInt(parts[1]);

        for (var i = startOctet; i <= endOctet; i++)
        {
            ipList.add(ipBase + i);
        }

        return ipList;
    }

}
