/**
 * Slider to native audio feature conversion.
 */
package com.phillippitts.vibedj.service.scaler;
