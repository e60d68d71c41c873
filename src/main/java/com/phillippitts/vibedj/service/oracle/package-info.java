/**
 * Contracts for the two external oracles: the vibe planner and the track recommender.
 *
 * <p>HTTP implementations live in {@code oracle.http}.
 */
package com.phillippitts.vibedj.service.oracle;
