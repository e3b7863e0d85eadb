/**
 * Orchestration of a daily portfolio run: parallel per-property detection
 * followed by the portfolio, root-cause, prediction and ranking stages.
 */
package com.scout.core.pipeline;
