package org.atmoswing.forecast.core.model;

/**
 * One value per entity, aligned with {@code entityIds}. Missing entities hold NaN.
 */
public record EntityValues(int[] entityIds, double[] values) {
}
