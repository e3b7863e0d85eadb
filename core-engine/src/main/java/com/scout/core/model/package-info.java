/**
 * Domain model: input rows and series, anomalies, portfolio patterns,
 * external events, root-cause attachments and predictions.
 */
package com.scout.core.model;
