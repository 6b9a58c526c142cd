/**
 * Request correlation for log lines.
 */
package com.phillippitts.catalogintel.config.logging;
