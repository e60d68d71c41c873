/**
 * Business services of the DJ pipeline, one sub-package per concern.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.coordinator} - the single-consumer event loop and pick pipeline</li>
 *   <li>{@code service.vibe} - vibe plan lifecycle and current targets</li>
 *   <li>{@code service.catalog} - nearest-track search and shortlist sampling</li>
 *   <li>{@code service.oracle} - vibe and recommender oracle contracts and HTTP clients</li>
 *   <li>{@code service.selector} - cooldown-weighted choice and backups</li>
 *   <li>{@code service.history} - play history and cooldown scoring</li>
 *   <li>{@code service.weights} - sampling weight overrides</li>
 *   <li>{@code service.playback} - remote player channel</li>
 *   <li>{@code service.chat} - chat and calendar context</li>
 *   <li>{@code service.scaler} - slider to native feature scaling</li>
 *   <li>{@code service.metrics}, {@code service.health} - observability</li>
 * </ul>
 *
 * <p>Services are wired explicitly in {@code config.DjConfig} and throw domain exceptions
 * from {@code com.phillippitts.vibedj.exception}, never HTTP ones.
 */
package com.phillippitts.vibedj.service;
