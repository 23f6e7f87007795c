package com.sysmon.entity;

import com.sysmon.dto.FilesystemUsage;
import jakarta.persistence.Embeddable;

@Embeddable
public class FilesystemEntry {

    private String mountPoint;
    private String device;
    private String filesystemType;
    private long totalBytes;
    private long usedBytes;
    private long freeBytes;
    private double percentUsed;

    public FilesystemEntry() {}

    public static FilesystemEntry from(FilesystemUsage fs) {
        FilesystemEntry e = new FilesystemEntry();
        e.mountPoint = fs.mountPoint();
        e.device = fs.device();
        e.filesystemType = fs.filesystemType();
        e.totalBytes = fs.totalBytes();
        e.usedBytes = fs.usedBytes();
        e.freeBytes = fs.freeBytes();
        e.percentUsed = fs.percentUsed();
        return e;
    }

    public FilesystemUsage toUsage() {
        return new FilesystemUsage(mountPoint, device, filesystemType, totalBytes, usedBytes, freeBytes, percentUsed);
    }

    public String getMountPoint() { return mountPoint; }
    public double getPercentUsed() { return percentUsed; }
}
