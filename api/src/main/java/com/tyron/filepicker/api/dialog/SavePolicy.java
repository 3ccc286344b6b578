package com.tyron.filepicker.api.dialog;

import java.util.Objects;

public record SavePolicy(boolean confirmOverwrite, ExtensionPolicy extensionPolicy) {

    public static final SavePolicy DEFAULT = new SavePolicy(true, ExtensionPolicy.ADD_IF_MISSING);

    public SavePolicy {
        Objects.requireNonNull(extensionPolicy, "extensionPolicy");
    }
}
