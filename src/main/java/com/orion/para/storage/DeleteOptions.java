package com.orion.para.storage;

public class DeleteOptions {
    private boolean removeFromIndex = true;
    private boolean createBackup = true;

    public static DeleteOptions defaults() {
        return new DeleteOptions();
    }

    public DeleteOptions removeFromIndex(boolean removeFromIndex) {
        this.removeFromIndex = removeFromIndex;
        return this;
    }

    public DeleteOptions createBackup(boolean createBackup) {
        this.createBackup = createBackup;
        return this;
    }

    public boolean isRemoveFromIndex() {
        return removeFromIndex;
    }

    public boolean isCreateBackup() {
        return createBackup;
    }
}
