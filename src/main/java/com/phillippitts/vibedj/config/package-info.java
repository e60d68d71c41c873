/**
 * Spring configuration: the {@link com.phillippitts.vibedj.config.DjConfig} composition root
 * and the player WebSocket registration.
 *
 * <p>Typed tunables live in {@code config.properties}.
 */
package com.phillippitts.vibedj.config;
