package com.colorchart.vision.core.marker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 标记 ID -> 角位置 映射表
 * <p>
 * 与模板生成器共享的常量，不在运行时推断。构建后不可变，可在线程间共享。
 */
public final class MarkerRoleTable {
    private final Map<CornerRole, Integer> idByRole;

    private MarkerRoleTable(Map<CornerRole, Integer> idByRole) {
        this.idByRole = Collections.unmodifiableMap(new EnumMap<>(idByRole));
    }

    /**
     * 默认映射：0→TL, 1→TR, 2→BR, 3→BL
     */
    public static MarkerRoleTable defaults() {
        return of(0, 1, 2, 3);
    }

    public static MarkerRoleTable of(int topLeft, int topRight, int bottomRight, int bottomLeft) {
        Map<CornerRole, Integer> map = new EnumMap<>(CornerRole.class);
        map.put(CornerRole.TOP_LEFT, topLeft);
        map.put(CornerRole.TOP_RIGHT, topRight);
        map.put(CornerRole.BOTTOM_RIGHT, bottomRight);
        map.put(CornerRole.BOTTOM_LEFT, bottomLeft);
        if (map.values().stream().distinct().count() != 4) {
            throw new IllegalArgumentException("Marker ids must be distinct: " + map.values());
        }
        return new MarkerRoleTable(map);
    }

    public int idFor(CornerRole role) {
        return idByRole.get(role);
    }

    /**
     * 按 TL, TR, BR, BL 顺序返回所需的标记 ID
     */
    public List<Integer> requiredIds() {
        List<Integer> ids = new ArrayList<>(4);
        for (CornerRole role : CornerRole.values()) {
            ids.add(idByRole.get(role));
        }
        return ids;
    }

    @Override
    public String toString() {
        return "MarkerRoleTable" + idByRole;
    }
}
