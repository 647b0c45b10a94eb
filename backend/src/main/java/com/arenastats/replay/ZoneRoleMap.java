package com.arenastats.replay;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable zone id to role mapping for one match. Updates return a new map.
 */
public final class ZoneRoleMap {

    private static final ZoneRoleMap EMPTY = new ZoneRoleMap(Map.of());

    private final Map<Integer, ZoneRole> roles;

    private ZoneRoleMap(Map<Integer, ZoneRole> roles) {
        this.roles = roles;
    }

    public static ZoneRoleMap empty() {
        return EMPTY;
    }

    public ZoneRoleMap with(int zoneId, ZoneRole role) {
        if (roles.containsKey(zoneId)) {
            throw new IllegalStateException("Zone " + zoneId + " is already labeled " + roles.get(zoneId));
        }
        Map<Integer, ZoneRole> next = new LinkedHashMap<>(roles);
        next.put(zoneId, role);
        return new ZoneRoleMap(Collections.unmodifiableMap(next));
    }

    public Optional<ZoneRole> roleOf(Integer zoneId) {
        return zoneId == null ? Optional.empty() : Optional.ofNullable(roles.get(zoneId));
    }

    public boolean isLabeled(Integer zoneId) {
        return zoneId != null && roles.containsKey(zoneId);
    }

    public boolean hasRole(Integer zoneId, ZoneRole role) {
        return roleOf(zoneId).filter(role::equals).isPresent();
    }

    public boolean hasKind(Integer zoneId, ZoneRole.Kind kind) {
        return roleOf(zoneId).filter(r -> r.getKind() == kind).isPresent();
    }

    /**
     * First zone carrying the given role, in labeling order.
     */
    public Optional<Integer> zoneWith(ZoneRole role) {
        return roles.entrySet().stream()
                .filter(entry -> entry.getValue() == role)
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public String labelOf(Integer zoneId) {
        return roleOf(zoneId).map(ZoneRole::getLabel).orElse(ZoneRole.UNKNOWN_LABEL);
    }

    public Map<Integer, ZoneRole> asMap() {
        return roles;
    }

    public int size() {
        return roles.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ZoneRoleMap other)) {
            return false;
        }
        return roles.equals(other.roles);
    }

    @Override
    public int hashCode() {
        return roles.hashCode();
    }

    @Override
    public String toString() {
        return "ZoneRoleMap" + roles;
    }
}
