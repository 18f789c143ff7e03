package com.spatialnote.backend.service.autosave;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Autosave switches. Bound from {@code spatialnote.autosave.*} and changed
 * at runtime through the pipeline.
 */
@ConfigurationProperties("spatialnote.autosave")
public class AutoSaveSettings {
    private volatile boolean enabled = true;
    private volatile Duration interval = Duration.ofSeconds(30);
    private volatile boolean saveOnFocusLoss = true;
    private volatile boolean saveOnMovement = true;
    private volatile boolean saveToLocalFiles = true;
    private volatile boolean saveToServer = false;
    private volatile String serverUrl = "http://localhost:8888";
    private volatile String serverToken = "";
    private volatile String serverPath = "autosave/workspace.ipynb";
    private volatile Duration serverTimeout = Duration.ofSeconds(10);
    private volatile Duration movementDebounce = Duration.ofSeconds(1);
    private volatile Duration workspaceDebounce = Duration.ofSeconds(1);
    private volatile int maxLocalFiles = 20;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public Duration getInterval() { return interval; }
    public void setInterval(Duration interval) { this.interval = interval; }

    public boolean isSaveOnFocusLoss() { return saveOnFocusLoss; }
    public void setSaveOnFocusLoss(boolean saveOnFocusLoss) { this.saveOnFocusLoss = saveOnFocusLoss; }

    public boolean isSaveOnMovement() { return saveOnMovement; }
    public void setSaveOnMovement(boolean saveOnMovement) { this.saveOnMovement = saveOnMovement; }

    public boolean isSaveToLocalFiles() { return saveToLocalFiles; }
    public void setSaveToLocalFiles(boolean saveToLocalFiles) { this.saveToLocalFiles = saveToLocalFiles; }

    public boolean isSaveToServer() { return saveToServer; }
    public void setSaveToServer(boolean saveToServer) { this.saveToServer = saveToServer; }

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getServerToken() { return serverToken; }
    public void setServerToken(String serverToken) { this.serverToken = serverToken; }

    public String getServerPath() { return serverPath; }
    public void setServerPath(String serverPath) { this.serverPath = serverPath; }

    public Duration getServerTimeout() { return serverTimeout; }
    public void setServerTimeout(Duration serverTimeout) { this.serverTimeout = serverTimeout; }

    public Duration getMovementDebounce() { return movementDebounce; }
    public void setMovementDebounce(Duration movementDebounce) { this.movementDebounce = movementDebounce; }

    public Duration getWorkspaceDebounce() { return workspaceDebounce; }
    public void setWorkspaceDebounce(Duration workspaceDebounce) { this.workspaceDebounce = workspaceDebounce; }

    public int getMaxLocalFiles() { return maxLocalFiles; }
    public void setMaxLocalFiles(int maxLocalFiles) { this.maxLocalFiles = maxLocalFiles; }
}
