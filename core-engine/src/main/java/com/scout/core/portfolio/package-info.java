/**
 * Cross-property pattern analysis: simultaneous, cascading and correlated
 * anomalies, portfolio health and pattern-level cause inference.
 */
package com.scout.core.portfolio;
