/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.routerkernel.app;

import com.intuitivedesigns.routerkernel.config.ConfigurationException;
import com.intuitivedesigns.routerkernel.core.ApiAuthorization;
import com.intuitivedesigns.routerkernel.engine.AuthorizationEngine;
import com.intuitivedesigns.routerkernel.robot.RobotRouterParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;
import java.util.Objects;

/**
 * Feeds the authorization file (and optional robot defaults) into the engine, again whenever either
 * file changes on disk. A rejected reload keeps the engine on its previous snapshot.
 */
public final class SnapshotReloader implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SnapshotReloader.class);

    private final AuthorizationEngine engine;
    private final Path authorizationFile;
    private final Path robotDefaultsFile;

    private volatile String lastStamp = "";

    /**
     * @param robotDefaultsFile may be null
     */
    public SnapshotReloader(AuthorizationEngine engine, Path authorizationFile, Path robotDefaultsFile) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.authorizationFile = Objects.requireNonNull(authorizationFile, "authorizationFile");
        this.robotDefaultsFile = robotDefaultsFile;
    }

    /**
     * Unconditional load, used at startup where a bad file must stop the process.
     */
    public synchronized void loadNow() throws ConfigurationException {
        final String stamp = stamp();
        final List<ApiAuthorization> records = AuthorizationFileLoader.load(authorizationFile);
        final RobotRouterParams defaults = robotDefaultsFile == null
                ? null
                : AuthorizationFileLoader.loadRobotDefaults(robotDefaultsFile);
        engine.loadSnapshot(records, defaults);
        lastStamp = stamp;
    }

    /**
     * @return true when a changed file was loaded successfully
     */
    public synchronized boolean reloadIfChanged() {
        final String stamp;
        try {
            stamp = stamp();
        } catch (ConfigurationException e) {
            log.warn("Skipping reload: {}", e.getMessage());
            return false;
        }
        if (stamp.equals(lastStamp)) {
            return false;
        }

        try {
            loadNow();
            log.info("Reloaded authorization configuration from {}", authorizationFile);
            return true;
        } catch (ConfigurationException e) {
            // Retried only once the files change again
            lastStamp = stamp;
            log.error("Reload rejected, previous configuration stays active: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void run() {
        try {
            reloadIfChanged();
        } catch (RuntimeException e) {
            // An escaping exception would cancel the scheduled task
            log.error("Unexpected failure during configuration reload", e);
        }
    }

    private String stamp() throws ConfigurationException {
        final StringBuilder sb = new StringBuilder(modified(authorizationFile));
        if (robotDefaultsFile != null) {
            sb.append('|').append(modified(robotDefaultsFile));
        }
        return sb.toString();
    }

    private static String modified(Path path) throws ConfigurationException {
        try {
            final FileTime t = Files.getLastModifiedTime(path);
            return t.toMillis() + ":" + Files.size(path);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot stat " + path + ": " + e.getMessage(), e);
        }
    }
}
