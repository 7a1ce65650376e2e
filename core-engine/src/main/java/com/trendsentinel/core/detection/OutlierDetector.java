package com.trendsentinel.core.detection;

import com.trendsentinel.core.model.DetectorResult;
import com.trendsentinel.core.model.TimeSeries;

import java.util.List;

/**
 * Contract for all outlier detectors of the ensemble.
 * <p>
 * Implementations are <strong>stateless</strong>: the verdict is a pure
 * function of the series and the detector's own parameters, so instances may
 * be shared between threads and series.
 * </p>
 * <p>
 * A detector that cannot run on a series, for example because it is too
 * short, throws
 * {@link com.trendsentinel.core.error.DetectorUnavailableException}; the
 * ensemble then excludes it from the vote.
 * </p>
 */
public interface OutlierDetector {

    /**
     * Score every point of the series.
     *
     * @param series the prepared series
     * @return exactly one result per point, in series order
     * @throws com.trendsentinel.core.error.DetectorUnavailableException if the
     *         detector cannot run on this series
     */
    List<DetectorResult> detect(TimeSeries series);

    /**
     * Return the unique name of this detector, used in output column names.
     *
     * @return detector name
     */
    String getName();
}
