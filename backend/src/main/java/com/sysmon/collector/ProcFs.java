package com.sysmon.collector;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class ProcFs {

    private final Path root;

    public ProcFs(Path root) {
        this.root = root;
    }

    public boolean exists(String relative) {
        return Files.isReadable(root.resolve(relative));
    }

    public List<String> readLines(String relative) throws CollectionException {
        Path file = root.resolve(relative);
        try {
            return Files.readAllLines(file);
        } catch (IOException e) {
            throw new CollectionException("Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    public Map<String, Long> readKeyValues(String relative) throws CollectionException {
        Map<String, Long> values = new HashMap<>();
        for (String line : readLines(relative)) {
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            String[] parts = line.substring(colon + 1).trim().split("\\s+");
            if (parts.length == 0 || parts[0].isEmpty()) continue;
            try {
                long value = Long.parseLong(parts[0]);
                if (parts.length > 1 && parts[1].equalsIgnoreCase("kB")) {
                    value *= 1024;
                }
                values.put(line.substring(0, colon).trim(), value);
            } catch (NumberFormatException ignored) {
                // non-numeric entries are not used
            }
        }
        return values;
    }

    static double percent(double part, double total) {
        if (total <= 0) return 0.0;
        double p = part / total * 100.0;
        p = Math.max(0.0, Math.min(100.0, p));
        return Math.round(p * 10.0) / 10.0;
    }
}
