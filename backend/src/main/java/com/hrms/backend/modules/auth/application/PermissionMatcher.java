package com.hrms.backend.modules.auth.application;

import java.util.Collection;

/**
 * Permission slug matching. A held slug satisfies a requirement when it is identical, or when it
 * is a module wildcard {@code module.*} and the requirement is {@code module.<action>}. A bare
 * {@code *} and other glob forms grant nothing.
 */
public final class PermissionMatcher {

    private static final String WILDCARD_SUFFIX = ".*";

    private PermissionMatcher() {
    }

    public static boolean matches(String held, String required) {
        if (held == null || required == null || held.isEmpty() || required.isEmpty()) {
            return false;
        }
        if (held.equals(required)) {
            return true;
        }
        if (!held.endsWith(WILDCARD_SUFFIX) || held.length() == WILDCARD_SUFFIX.length()) {
            return false;
        }
        // keep the dot so that "pay.*" does not cover "payroll.approve"
        String modulePrefix = held.substring(0, held.length() - 1);
        return required.startsWith(modulePrefix) && required.length() > modulePrefix.length();
    }

    public static boolean isGranted(Collection<String> held, String required) {
        for (String permission : held) {
            if (matches(permission, required)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasAny(Collection<String> held, Collection<String> required) {
        if (required.isEmpty()) {
            return true;
        }
        for (String permission : required) {
            if (isGranted(held, permission)) {
                return true;
            }
        }
        return false;
    }

    public static boolean hasAll(Collection<String> held, Collection<String> required) {
        for (String permission : required) {
            if (!isGranted(held, permission)) {
                return false;
            }
        }
        return true;
    }
}
