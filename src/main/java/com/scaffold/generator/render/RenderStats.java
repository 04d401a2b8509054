package com.scaffold.generator.render;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Counters and error messages accumulated during one rendering run.
 *
 * Pure structure only: no logging, no IO.
 */
@Getter
public class RenderStats {
    private int filesCreated;
    private int directoriesCreated;
    private int filesSkipped;
    private int filesOverwritten;
    private final List<String> errors = new ArrayList<>();

    void fileCreated() {
        filesCreated++;
    }

    void directoryCreated() {
        directoriesCreated++;
    }

    void fileSkipped() {
        filesSkipped++;
    }

    void fileOverwritten() {
        filesOverwritten++;
    }

    void error(String message) {
        errors.add(message);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * Files written by the run, new or replaced.
     */
    public int getFilesWritten() {
        return filesCreated + filesOverwritten;
    }

    @Override
    public String toString() {
        return "RenderStats{filesCreated=" + filesCreated
                + ", directoriesCreated=" + directoriesCreated
                + ", filesSkipped=" + filesSkipped
                + ", filesOverwritten=" + filesOverwritten
                + ", errors=" + errors + "}";
    }
}
