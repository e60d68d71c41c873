/**
 * Actuator health for the coordinator loop and player connection.
 */
package com.phillippitts.vibedj.service.health;
