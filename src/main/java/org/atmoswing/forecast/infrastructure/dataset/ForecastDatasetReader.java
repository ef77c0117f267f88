package org.atmoswing.forecast.infrastructure.dataset;

import java.nio.file.Path;

/**
 * Opens forecast files. Implementations throw
 * {@link org.atmoswing.forecast.core.exception.ForecastNotFoundException} when the path does not exist.
 */
public interface ForecastDatasetReader {

    ForecastDataset open(Path file);
}
