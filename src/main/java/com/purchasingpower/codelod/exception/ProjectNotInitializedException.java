package com.purchasingpower.codelod.exception;

import java.nio.file.Path;

public class ProjectNotInitializedException extends RuntimeException {

    public ProjectNotInitializedException(Path searchedFrom) {
        super("code-lod not initialized in " + searchedFrom + ". Run 'code-lod init' first.");
    }
}
