/**
 * Per-property detectors (disaster, spam, record, trend, segment) and the
 * shared dimensional windowing they are built on.
 */
package com.scout.core.detection;
