/**
 * Series preparation: validation of the input table, grouping, deduplication,
 * frequency inference, resampling and gap filling.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.preparation;
