package com.tyron.filepicker.api.dialog;

import java.util.Objects;

public record SortSpec(SortBy by, boolean ascending, boolean directoriesFirst) {

    public static final SortSpec DEFAULT = new SortSpec(SortBy.NAME, true, true);

    public SortSpec {
        Objects.requireNonNull(by, "by");
    }

    public SortSpec withBy(SortBy newBy) {
        return new SortSpec(newBy, ascending, directoriesFirst);
    }

    public SortSpec toggleDirection() {
        return new SortSpec(by, !ascending, directoriesFirst);
    }
}
