/**
 * Forward-looking predictions: trend, weekly seasonality, calendar events and
 * pattern propagation, plus reporting and validation.
 */
package com.scout.core.prediction;
