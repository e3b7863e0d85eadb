/**
 * Unified, ranked alert feed.
 */
package com.scout.core.alerting;
