/**
 * Daily batch entry point: loads property files, runs the portfolio pipeline
 * and writes the JSON reports.
 *
 * <p>
 * All runtime settings are read from environment variables by
 * {@link com.scout.batch.JobConfig}.
 * </p>
 */
package com.scout.batch;
