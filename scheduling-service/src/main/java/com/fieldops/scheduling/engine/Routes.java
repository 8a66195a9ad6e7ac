package com.fieldops.scheduling.engine;

/**
 * Copy-on-write helpers for route arrays. Callers never modify an array they did not create.
 */
final class Routes {

    static final int[] EMPTY = new int[0];

    private Routes() {}

    static int[] insert(int[] route, int position, int job) {
        int[] result = new int[route.length + 1];
        System.arraycopy(route, 0, result, 0, position);
        result[position] = job;
        System.arraycopy(route, position, result, position + 1, route.length - position);
        return result;
    }

    static int[] remove(int[] route, int position) {
        int[] result = new int[route.length - 1];
        System.arraycopy(route, 0, result, 0, position);
        System.arraycopy(route, position + 1, result, position, route.length - position - 1);
        return result;
    }

    static int[] replace(int[] route, int position, int job) {
        int[] result = route.clone();
        result[position] = job;
        return result;
    }

    static int indexOf(int[] route, int job) {
        for (int k = 0; k < route.length; k++) {
            if (route[k] == job) {
                return k;
            }
        }
        return -1;
    }
}
