/**
 * REST controllers.
 */
package com.phillippitts.catalogintel.presentation.controller;
