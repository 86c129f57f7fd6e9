package com.pulsenms.core;

/**
 * Raised when a probe capability is missing on this host, as opposed to a target not answering.
 */
public class ProbeUnavailableException extends RuntimeException
{

    public ProbeUnavailableException(String message, Throwable cause)
    {
        super(message, cause);
    }

}
