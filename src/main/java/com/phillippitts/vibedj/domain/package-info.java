/**
 * Immutable domain model: sliders and plans, catalog tracks, history records and pick results.
 *
 * <p>All types are records or enums. Sliders are clamped on construction so
 * {@link com.phillippitts.vibedj.domain.AudioTargets} can never hold a value outside [0, 100].
 */
package com.phillippitts.vibedj.domain;
