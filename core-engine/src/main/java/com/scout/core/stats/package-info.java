/**
 * z-score, IQR and consensus outlier primitives.
 */
package com.scout.core.stats;
