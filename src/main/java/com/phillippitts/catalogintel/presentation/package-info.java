/**
 * REST surface: controllers, request and response bodies, and error mapping.
 */
package com.phillippitts.catalogintel.presentation;
