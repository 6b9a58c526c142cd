/**
 * Request and response bodies for the prediction endpoints.
 *
 * <p>Jackson is configured with snake_case naming, so {@code productId} travels as
 * {@code product_id}.
 */
package com.phillippitts.catalogintel.presentation.dto;
