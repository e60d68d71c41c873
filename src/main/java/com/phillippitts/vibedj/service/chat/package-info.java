/**
 * Chat and calendar context sources.
 */
package com.phillippitts.vibedj.service.chat;
