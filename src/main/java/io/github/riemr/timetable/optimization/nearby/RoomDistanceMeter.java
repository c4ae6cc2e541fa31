package io.github.riemr.timetable.optimization.nearby;

/**
 * 教室間の抽象距離。
 * ID の先頭 1 文字を棟（種別）とみなし、残りを部屋番号とする。
 * 同一棟なら番号差 / 5、異なる棟なら固定値。"LAB1" と "L2" は同じ棟 'L' で番号が読めないため 1。
 */
public class RoomDistanceMeter {

    public static final int DIFFERENT_BUILDING_DISTANCE = 3;
    public static final int UNKNOWN_NUMBER_DISTANCE = 1;
    private static final int ROOMS_PER_DISTANCE_UNIT = 5;

    public int distance(String room1, String room2) {
        if (room1 == null || room2 == null) {
            return 0;
        }
        if (room1.equals(room2)) {
            return 0;
        }
        if (room1.isEmpty() || room2.isEmpty() || room1.charAt(0) != room2.charAt(0)) {
            return DIFFERENT_BUILDING_DISTANCE;
        }
        try {
            int n1 = Integer.parseInt(room1.substring(1));
            int n2 = Integer.parseInt(room2.substring(1));
            // 整数除算（隣接 5 室までは距離 0）
            return Math.abs(n1 - n2) / ROOMS_PER_DISTANCE_UNIT;
        } catch (NumberFormatException ex) {
            return UNKNOWN_NUMBER_DISTANCE;
        }
    }
}
