/**
 * Reading property datasets at the property boundary.
 */
package com.scout.core.io;
