package com.sysmon.collector;

import com.sysmon.dto.NetworkMetrics;

import java.util.List;
import java.util.Optional;

public class NetworkCollector implements MetricCollector<NetworkMetrics> {

    private static final String FILE = "net/dev";

    private final ProcFs procFs;

    public NetworkCollector(ProcFs procFs) {
        this.procFs = procFs;
    }

    @Override
    public String name() {
        return "network";
    }

    @Override
    public boolean isAvailable() {
        return procFs.exists(FILE);
    }

    @Override
    public Optional<NetworkMetrics> collect() throws CollectionException {
        if (!procFs.exists(FILE)) {
            return Optional.empty();
        }
        List<String> lines = procFs.readLines(FILE);
        long bytesRecv = 0, errorsIn = 0, bytesSent = 0, errorsOut = 0;
        for (String line : lines) {
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String iface = line.substring(0, colon).trim();
            if (iface.equals("lo")) continue;
            String[] f = line.substring(colon + 1).trim().split("\\s+");
            if (f.length < 11) {
                throw new CollectionException("Malformed /proc/net/dev line for " + iface);
            }
            try {
                // receive: bytes packets errs drop fifo frame compressed multicast; transmit: bytes packets errs ...
                bytesRecv += Long.parseLong(f[0]);
                errorsIn += Long.parseLong(f[2]);
                bytesSent += Long.parseLong(f[8]);
                errorsOut += Long.parseLong(f[10]);
            } catch (NumberFormatException e) {
                throw new CollectionException("Malformed /proc/net/dev line for " + iface, e);
            }
        }
        return Optional.of(new NetworkMetrics(bytesSent, bytesRecv, errorsIn, errorsOut));
    }
}
