/**
 * Maps domain exceptions to HTTP responses.
 */
package com.phillippitts.catalogintel.presentation.exception;
