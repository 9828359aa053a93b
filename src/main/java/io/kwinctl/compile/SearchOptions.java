package io.kwinctl.compile;

import java.util.Objects;

/**
 * Criteria of a {@code search} directive.
 */
public record SearchOptions(
    boolean matchClass,
    boolean matchClassname,
    boolean matchRole,
    boolean matchName,
    boolean matchPid,
    int pid,
    boolean matchDesktop,
    int desktop,
    boolean matchScreen,
    int screen,
    int limit,
    boolean matchAll,
    String searchTerm
) {
    public SearchOptions {
        Objects.requireNonNull(searchTerm, "searchTerm");
    }

    /**
     * Mutable accumulator used while the flags are read.
     */
    static final class Builder {
        boolean matchClass;
        boolean matchClassname;
        boolean matchRole;
        boolean matchName;
        boolean matchPid;
        int pid;
        boolean matchDesktop;
        int desktop;
        boolean matchScreen;
        int screen;
        int limit;
        boolean matchAll;
        String searchTerm;

        SearchOptions build() {
            boolean anyAttribute = matchClass || matchClassname || matchRole || matchName;
            return new SearchOptions(
                anyAttribute ? matchClass : true,
                anyAttribute ? matchClassname : true,
                anyAttribute ? matchRole : true,
                anyAttribute ? matchName : true,
                matchPid,
                pid,
                matchDesktop,
                desktop,
                matchScreen,
                screen,
                limit,
                matchAll,
                searchTerm == null ? "" : searchTerm
            );
        }
    }
}
