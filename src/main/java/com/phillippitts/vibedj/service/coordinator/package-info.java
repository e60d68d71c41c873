/**
 * The single-consumer DJ loop.
 *
 * <p>All mutating operations become {@link com.phillippitts.vibedj.service.coordinator.DjEvent}s
 * on one queue; {@link com.phillippitts.vibedj.service.coordinator.DjCoordinator} handles them
 * in order on its own thread, so at most one pick runs at a time. Each pick goes through
 * {@link com.phillippitts.vibedj.service.coordinator.PickPipeline}.
 *
 * @see com.phillippitts.vibedj.service.coordinator.DjStatus
 */
package com.phillippitts.vibedj.service.coordinator;
