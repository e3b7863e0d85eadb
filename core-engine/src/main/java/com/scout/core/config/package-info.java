/**
 * Threshold configuration: the {@code scout.yml} bean tree and its loader.
 */
package com.scout.core.config;
