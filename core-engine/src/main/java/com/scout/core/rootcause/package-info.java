/**
 * Root-cause correlation of anomalies against the versioned external event
 * calendar.
 */
package com.scout.core.rootcause;
