package com.orion.para.storage;

public class ReadOptions {
    private boolean validate = true;

    public static ReadOptions defaults() {
        return new ReadOptions();
    }

    /**
     * Skip schema checks. The text is still parsed.
     */
    public static ReadOptions unvalidated() {
        return new ReadOptions().validate(false);
    }

    public ReadOptions validate(boolean validate) {
        this.validate = validate;
        return this;
    }

    public boolean isValidate() {
        return validate;
    }
}
