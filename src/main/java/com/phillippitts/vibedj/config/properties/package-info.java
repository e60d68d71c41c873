/**
 * Validated {@code @ConfigurationProperties} for the {@code dj.*} namespaces.
 *
 * <p>Each class binds through its constructor, fills defaults for absent values and offers
 * a static {@code defaults()} for tests:
 * <ul>
 *   <li>{@code dj.coordinator.*} - loop timing, debounce and candidate counts</li>
 *   <li>{@code dj.vibe.*} - plan recheck, backoff and chat signature</li>
 *   <li>{@code dj.catalog.*} - backend choice, pool sizes, windows and boosts</li>
 *   <li>{@code dj.cooldown.*} - track and artist recovery rates</li>
 *   <li>{@code dj.oracle.*} - oracle endpoints and request timeout</li>
 * </ul>
 */
package com.phillippitts.vibedj.config.properties;
