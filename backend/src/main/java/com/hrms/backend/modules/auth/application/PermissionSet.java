package com.hrms.backend.modules.auth.application;

import java.util.List;

public record PermissionSet(List<String> roles, List<String> permissions) {

    public PermissionSet {
        roles = roles == null ? List.of() : List.copyOf(roles);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static PermissionSet empty() {
        return new PermissionSet(List.of(), List.of());
    }
}
