package com.orion.para.storage;

import java.io.IOException;

public class AtomicWriteException extends IOException {

    public enum Stage {
        WRITE,
        RENAME
    }

    private final Stage stage;

    public AtomicWriteException(Stage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public Stage getStage() {
        return stage;
    }
}
