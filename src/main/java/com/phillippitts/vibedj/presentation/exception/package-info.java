/**
 * Exception-to-HTTP mapping for the REST surface.
 */
package com.phillippitts.vibedj.presentation.exception;
