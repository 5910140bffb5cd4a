package com.layoutmapper.cli.model;

import java.nio.file.Path;

import com.layoutmapper.engine.EngineConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps MapCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedMapOptions {
    EngineConfig engineConfig;
    /**
     * Null when nothing is written to disk.
     */
    Path normalizedOutputDir;
    Path scaffoldFile;
    Path interfacesFile;

    public boolean isWritingFiles() {
        return normalizedOutputDir != null;
    }
}
