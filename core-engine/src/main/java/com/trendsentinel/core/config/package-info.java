/**
 * Analysis configuration: the immutable
 * {@link com.trendsentinel.core.config.AnalysisConfig}, its YAML loader and
 * the enums and input layout it is made of.
 *
 * @since 1.0.0
 */
package com.trendsentinel.core.config;
