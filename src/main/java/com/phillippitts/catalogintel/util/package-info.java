/**
 * Small helpers for time arithmetic, record deadlines and log-safe text previews.
 */
package com.phillippitts.catalogintel.util;
