package com.sysmon.collector;

import com.sysmon.dto.DiskMetrics;
import com.sysmon.dto.FilesystemUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Usage of every mounted filesystem listed in {@code /proc/mounts}, skipping pseudo and
 * excluded filesystem types. A filesystem that cannot be read is left out of the snapshot
 * and logged; the others are still reported. Without {@code /proc/mounts} the file system
 * roots are reported.
 */
public class DiskCollector implements MetricCollector<DiskMetrics> {

    private static final Logger log = LoggerFactory.getLogger(DiskCollector.class);

    private final ProcFs procFs;
    private final Set<String> excludedTypes;

    public DiskCollector(ProcFs procFs, Set<String> excludedTypes) {
        this.procFs = procFs;
        this.excludedTypes = Set.copyOf(excludedTypes);
    }

    @Override
    public String name() {
        return "disk";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<DiskMetrics> collect() throws CollectionException {
        List<FilesystemUsage> filesystems = new ArrayList<>();
        for (Mount mount : mounts()) {
            try {
                usage(mount).ifPresent(filesystems::add);
            } catch (IOException | RuntimeException e) {
                log.atWarn()
                    .addKeyValue("error_type", "CollectionError")
                    .addKeyValue("collector", name())
                    .addKeyValue("mount_point", mount.mountPoint())
                    .log("Skipping unreadable filesystem {}: {}", mount.mountPoint(), e.getMessage());
            }
        }
        return Optional.of(new DiskMetrics(filesystems));
    }

    List<Mount> mounts() throws CollectionException {
        if (!procFs.exists("mounts")) {
            List<Mount> roots = new ArrayList<>();
            for (File root : File.listRoots()) {
                roots.add(new Mount(null, root.getPath(), null));
            }
            return roots;
        }
        Map<String, Mount> byMountPoint = new LinkedHashMap<>();
        for (String line : procFs.readLines("mounts")) {
            String[] parts = line.trim().split("\\s+");
            if (parts.length < 3) continue;
            String type = parts[2];
            if (excludedTypes.contains(type)) continue;
            String mountPoint = unescape(parts[1]);
            // a later mount on the same point shadows the earlier one
            byMountPoint.remove(mountPoint);
            byMountPoint.put(mountPoint, new Mount(unescape(parts[0]), mountPoint, type));
        }
        return new ArrayList<>(byMountPoint.values());
    }

    private Optional<FilesystemUsage> usage(Mount mount) throws IOException {
        FileStore store = Files.getFileStore(Path.of(mount.mountPoint()));
        long total = store.getTotalSpace();
        if (total <= 0) {
            return Optional.empty();
        }
        long free = Math.min(store.getUsableSpace(), total);
        long used = Math.max(0, total - store.getUnallocatedSpace());
        if (used + free > total) {
            used = total - free;
        }
        return Optional.of(new FilesystemUsage(mount.mountPoint(), mount.device(), mount.type(),
            total, used, free, ProcFs.percent(used, used + free)));
    }

    static String unescape(String value) {
        if (value.indexOf('\\') < 0) return value;
        StringBuilder sb = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\\' && isOctal(value, i + 1)) {
                sb.append((char) Integer.parseInt(value.substring(i + 1, i + 4), 8));
                i += 3;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static boolean isOctal(String value, int from) {
        if (from + 3 > value.length()) return false;
        for (int i = from; i < from + 3; i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '7') return false;
        }
        return true;
    }

    record Mount(String device, String mountPoint, String type) {}
}
