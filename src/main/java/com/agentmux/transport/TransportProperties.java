package com.agentmux.transport;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "agentmux.transport")
public class TransportProperties {

    private String executable = "claude";
    private int ioTimeoutSeconds = 30;
    private int readIdleTimeoutSeconds = 30;
    private int graceSeconds = 5;
    private int maxFrameBytes = 1024 * 1024;
    private int writeQueueCapacity = 64;
    private int stderrTailLines = 20;

    public String getExecutable() { return executable; }
    public void setExecutable(String executable) { this.executable = executable; }
    public int getIoTimeoutSeconds() { return ioTimeoutSeconds; }
    public void setIoTimeoutSeconds(int ioTimeoutSeconds) { this.ioTimeoutSeconds = ioTimeoutSeconds; }

    /** Longest silence tolerated while a prompt is awaiting its result; 0 disables the check. */
    public int getReadIdleTimeoutSeconds() { return readIdleTimeoutSeconds; }
    public void setReadIdleTimeoutSeconds(int readIdleTimeoutSeconds) { this.readIdleTimeoutSeconds = readIdleTimeoutSeconds; }
    public int getGraceSeconds() { return graceSeconds; }
    public void setGraceSeconds(int graceSeconds) { this.graceSeconds = graceSeconds; }
    public int getMaxFrameBytes() { return maxFrameBytes; }
    public void setMaxFrameBytes(int maxFrameBytes) { this.maxFrameBytes = maxFrameBytes; }
    public int getWriteQueueCapacity() { return writeQueueCapacity; }
    public void setWriteQueueCapacity(int writeQueueCapacity) { this.writeQueueCapacity = writeQueueCapacity; }
    public int getStderrTailLines() { return stderrTailLines; }
    public void setStderrTailLines(int stderrTailLines) { this.stderrTailLines = stderrTailLines; }
}
