/**
 * Per-genre, per-artist and per-track sampling factors.
 */
package com.phillippitts.vibedj.service.weights;
