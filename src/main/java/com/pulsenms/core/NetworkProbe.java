package com.pulsenms.core;

import com.pulsenms.models.PingResult;

import com.pulsenms.models.ProbeOutcome;

import com.pulsenms.models.SnmpResult;

import org.slf4j.Logger;

import org.slf4j.LoggerFactory;

import org.snmp4j.CommunityTarget;

import org.snmp4j.PDU;

import org.snmp4j.Snmp;

import org.snmp4j.mp.SnmpConstants;

import org.snmp4j.smi.Counter64;

import org.snmp4j.smi.Integer32;

import org.snmp4j.smi.OID;

import org.snmp4j.smi.OctetString;

import org.snmp4j.smi.UdpAddress;

import org.snmp4j.smi.UnsignedInteger32;

import org.snmp4j.smi.Variable;

import org.snmp4j.smi.VariableBinding;

import org.snmp4j.transport.DefaultUdpTransportMapping;

import java.io.BufferedReader;

import java.io.IOException;

import java.io.InputStreamReader;

import java.nio.charset.StandardCharsets;

import java.util.concurrent.TimeUnit;

import java.util.concurrent.atomic.AtomicBoolean;

import java.util.regex.Pattern;

/**
 * NetworkProbe - fping and SNMP4J backed ProtocolProbe

 * Ping:
 * - Runs one fping process per call: fping -c COUNT -t TIMEOUT -q IP
 * - Parses the summary line "ip : xmt/rcv/%loss = 3/3/0%, min/avg/max = 0.1/0.2/0.3"

 * SNMP:
 * - SNMP v2c GET over a shared UDP session, no retries (the caller owns retry policy)

 * WARNING: All methods are BLOCKING and must be called from a worker thread.
 */
public class NetworkProbe implements ProtocolProbe
{

    private static final Logger logger = LoggerFactory.getLogger(NetworkProbe.class);

    private static final Pattern FPING_SUMMARY = Pattern.compile(
        "xmt/rcv/%loss = (\\d+)/(\\d+)/(\\d+)%(?:, min/avg/max = ([\\d.]+)/([\\d.]+)/([\\d.]+))?"
    );

    private final String fpingPath;

    private final AtomicBoolean fpingMissingLogged = new AtomicBoolean(false);

    private Snmp snmp;

    /**
     * @param fpingPath Path of the fping executable
     */
    public NetworkProbe(String fpingPath)
    {
        this.fpingPath = fpingPath;
    }

    @Override
    public PingResult ping(String ip, int timeoutMs, int count)
    {
        var packets = Math.max(1, count);

        Process process;

        try
        {
            process = new ProcessBuilder(
                fpingPath, "-c", String.valueOf(packets), "-t", String.valueOf(timeoutMs), "-p", "200", "-q", ip
            ).redirectErrorStream(true).start();
        }
        catch (IOException exception)
        {
            if (fpingMissingLogged.compareAndSet(false, true))
            {
                logger.warn("fping not available at '{}': {} - ping checks are skipped until it is installed",
                    fpingPath, exception.getMessage());
            }

            throw new ProbeUnavailableException("fping not available: " + fpingPath, exception);
        }

        try
        {
            var output = new StringBuilder();

            try (var reader = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.US_ASCII)))
            {
                String line;

                while ((line = reader.readLine()) != null)
                {
                    output.append(line).append('\n');
                }
            }

            // Upper bound on top of fping's own per-packet timeout
            var finished = process.waitFor((long) packets * (timeoutMs + 200) + 2000, TimeUnit.MILLISECONDS);

            if (!finished)
            {
                process.destroyForcibly();

                logger.debug("fping for {} did not finish in time", ip);

                return PingResult.failure(ProbeOutcome.TIMEOUT);
            }

            return parseFpingSummary(output.toString());
        }
        catch (InterruptedException exception)
        {
            process.destroyForcibly();

            Thread.currentThread().interrupt();

            return PingResult.failure(ProbeOutcome.TIMEOUT);
        }
        catch (IOException exception)
        {
            logger.debug("Error reading fping output for {}: {}", ip, exception.getMessage());

            return PingResult.failure(ProbeOutcome.UNREACHABLE);
        }
    }

    /**
     * Parse the fping -q summary output.
     *
     * @param output Combined stdout/stderr of fping
     * @return Ping result, UNREACHABLE when no summary line was printed (e.g. unknown host)
     */
    static PingResult parseFpingSummary(String output)
    {
        var matcher = FPING_SUMMARY.matcher(output);

        if (!matcher.find())
        {
            return PingResult.failure(ProbeOutcome.UNREACHABLE);
        }

        var received = Integer.parseInt(matcher.group(2));

        var loss = Double.parseDouble(matcher.group(3));

        if (received == 0 || matcher.group(5) == null)
        {
            return PingResult.failure(ProbeOutcome.TIMEOUT);
        }

        return PingResult.success(Double.parseDouble(matcher.group(5)), loss);
    }

    @Override
    public SnmpResult snmpGet(String ip, int port, String community, String oid, int timeoutMs)
    {
        var session = session();

        var target = new CommunityTarget<UdpAddress>(new UdpAddress(ip + "/" + port), new OctetString(community));

        target.setVersion(SnmpConstants.version2c);

        target.setTimeout(timeoutMs);

        target.setRetries(0);

        var pdu = new PDU();

        pdu.setType(PDU.GET);

        pdu.add(new VariableBinding(new OID(oid)));

        try
        {
            var started = System.nanoTime();

            var event = session.send(pdu, target);

            var latencyMs = (System.nanoTime() - started) / 1_000_000.0;

            var response = event != null ? event.getResponse() : null;

            if (response == null)
            {
                return SnmpResult.failure(ProbeOutcome.TIMEOUT);
            }

            switch (response.getErrorStatus())
            {
                case PDU.noError:
                    break;

                case PDU.authorizationError:
                case PDU.noAccess:
                    return SnmpResult.failure(ProbeOutcome.AUTH_ERROR);

                case PDU.noSuchName:
                    return SnmpResult.failure(ProbeOutcome.NO_SUCH_OBJECT);

                default:
                    logger.debug("SNMP error from {} for {}: {}", ip, oid, response.getErrorStatusText());

                    return SnmpResult.failure(ProbeOutcome.UNREACHABLE);
            }

            if (response.size() == 0)
            {
                return SnmpResult.failure(ProbeOutcome.NO_SUCH_OBJECT);
            }

            var variable = response.get(0).getVariable();

            if (variable == null || variable.isException())
            {
                return SnmpResult.failure(ProbeOutcome.NO_SUCH_OBJECT);
            }

            return SnmpResult.success(render(variable), latencyMs);
        }
        catch (IOException exception)
        {
            logger.debug("SNMP GET {} on {} failed: {}", oid, ip, exception.getMessage());

            return SnmpResult.failure(ProbeOutcome.UNREACHABLE);
        }
    }

    // Numeric SMI types as plain numbers (TimeTicks would otherwise render as "1 day, 2:03:04.00")
    static String render(Variable variable)
    {
        if (variable instanceof Counter64)
        {
            // Counter64 is unsigned, toLong() would go negative above 2^63
            return Long.toUnsignedString(((Counter64) variable).getValue());
        }

        if (variable instanceof UnsignedInteger32 || variable instanceof Integer32)
        {
            return String.valueOf(variable.toLong());
        }

        return variable.toString();
    }

    private synchronized Snmp session()
    {
        if (snmp == null)
        {
            try
            {
                var transport = new DefaultUdpTransportMapping();

                var session = new Snmp(transport);

                transport.listen();

                snmp = session;

                logger.debug("SNMP session opened");
            }
            catch (IOException exception)
            {
                throw new ProbeUnavailableException("Cannot open SNMP transport", exception);
            }
        }

        return snmp;
    }

    /**
     * Close the shared SNMP session. Should be called during application shutdown.
     */
    public synchronized void close()
    {
        if (snmp != null)
        {
            try
            {
                snmp.close();

                logger.debug("SNMP session closed");
            }
            catch (IOException exception)
            {
                logger.warn("Error closing SNMP session: {}", exception.getMessage());
            }

            snmp = null;
        }
    }

}
