package com.pulsenms.models;

import java.util.EnumSet;

import java.util.Set;

/**
 * Protocols a discovery scan can use.
 */
public enum DiscoveryProtocol
{

    ICMP,

    SNMP;

    /**
     * Parse protocol names ("icmp", "snmp") ignoring case and unknown entries.
     *
     * @param names Protocol names
     * @return Set of protocols, both when the input is empty
     */
    public static Set<DiscoveryProtocol> parse(Iterable<?> names)
    {
        var protocols = EnumSet.noneOf(DiscoveryProtocol.class);

        if (names != null)
        {
            for (var name : names)
            {
                if (name == null)
                {
                    continue;
                }

                for (var protocol : values())
                {
                    if (protocol.name().equalsIgnoreCase(name.toString().trim()))
                    {
                        protocols.add(protocol);
                    }
                }
            }
        }

        return protocols.isEmpty() ? EnumSet.allOf(DiscoveryProtocol.class) : protocols;
    }
}
