package com.orion.para.storage;

public class WriteOptions {
    private boolean validate = true;
    private boolean updateIndex = true;
    private boolean createBackup = true;

    public static WriteOptions defaults() {
        return new WriteOptions();
    }

    public WriteOptions validate(boolean validate) {
        this.validate = validate;
        return this;
    }

    public WriteOptions updateIndex(boolean updateIndex) {
        this.updateIndex = updateIndex;
        return this;
    }

    public WriteOptions createBackup(boolean createBackup) {
        this.createBackup = createBackup;
        return this;
    }

    public boolean isValidate() {
        return validate;
    }

    public boolean isUpdateIndex() {
        return updateIndex;
    }

    public boolean isCreateBackup() {
        return createBackup;
    }
}
