/**
 * Immutable value types shared across the turn pipeline: turns, dialog states, pending questions
 * and turn responses.
 *
 * <p>Nothing in this package depends on Spring.
 *
 * @since 1.0
 */
package com.phillippitts.voicetutor.domain;
