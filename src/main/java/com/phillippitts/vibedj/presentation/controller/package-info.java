/**
 * REST controllers for operating the DJ.
 *
 * <p>{@link com.phillippitts.vibedj.presentation.controller.DjController} exposes
 * {@code /api/dj/*}: enable/disable, continuous mode, manual picks, backups, status and
 * sampling weight overrides. Errors are mapped by
 * {@code presentation.exception.GlobalExceptionHandler}.
 */
package com.phillippitts.vibedj.presentation.controller;
