/**
 * Wire codec boundary for Janus envelopes.
 *
 * <p>Ports in this package translate between complete datagram payloads and the
 * typed request/response values in {@code com.questrail.janus.api}. Concrete
 * implementations live in {@code codec.impl}.</p>
 *
 * <p>Nothing here interprets commands, validates arguments or schedules work.</p>
 */
package com.questrail.janus.codec;
