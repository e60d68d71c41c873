/**
 * Cooldown-weighted random choice among recommender candidates, with the ordered backup queue.
 */
package com.phillippitts.vibedj.service.selector;
